package ossim.gui;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.stage.Stage;
import ossim.kernel.KernelConfig;

public class GuiApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        KernelConfig config = KernelConfig.load();

        MainController controller = new MainController(config);
        Scene scene = new Scene(controller.getView(), 1200, 800);

        primaryStage.setTitle("OS Resource Management Simulator");
        primaryStage.setScene(scene);
        primaryStage.setOnCloseRequest(e -> Platform.exit());
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
