package ossim.gui.components;

import javafx.geometry.Insets;
import javafx.scene.control.TextArea;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;

/**
 * Read-only console pane showing the simulation trace.
 */
public class ConsoleView extends VBox {

    private final TextArea outputArea;

    public ConsoleView() {
        this.setPadding(new Insets(5));

        outputArea = new TextArea();
        outputArea.setEditable(false);
        outputArea
                .setStyle("-fx-font-family: 'Courier New'; -fx-control-inner-background: black; -fx-text-fill: white;");
        outputArea.setWrapText(true);

        VBox.setVgrow(outputArea, Priority.ALWAYS);
        this.getChildren().add(outputArea);
    }

    public TextArea getOutputArea() {
        return outputArea;
    }
}
