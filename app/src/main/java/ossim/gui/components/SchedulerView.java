package ossim.gui.components;

import java.util.stream.Collectors;

import javafx.collections.FXCollections;
import javafx.geometry.Insets;
import javafx.scene.control.Label;
import javafx.scene.control.ListView;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import ossim.exception.EmptyResultException;
import ossim.kernel.scheduler.CpuScheduler;
import ossim.kernel.scheduler.SchedulerStats;

public class SchedulerView extends VBox {

    private final ListView<String> readyList;
    private final ListView<String> completedList;
    private final Label averages;

    public SchedulerView() {
        this.setSpacing(5);
        this.setPadding(new Insets(5));

        readyList = new ListView<>();
        VBox.setVgrow(readyList, Priority.ALWAYS);

        completedList = new ListView<>();
        VBox.setVgrow(completedList, Priority.ALWAYS);

        averages = new Label();

        this.getChildren().addAll(
                new Label("Ready Queue:"), readyList,
                new Label("Completed:"), completedList,
                averages);
    }

    public void update(CpuScheduler scheduler) {
        if (scheduler == null)
            return;

        // PID [Name] (State)
        readyList.setItems(FXCollections.observableArrayList(
                scheduler.getReadyTasks().stream()
                        .map(t -> String.format("PID %d [%s] (%s)", t.getId(), t.getName(), t.getState()))
                        .collect(Collectors.toList())));

        try {
            SchedulerStats stats = scheduler.statistics();
            completedList.setItems(FXCollections.observableArrayList(
                    stats.getTasks().stream()
                            .map(t -> String.format("PID %d [%s] wait=%d turnaround=%d done@%d",
                                    t.getPid(), t.getName(), t.getWaitingTime(), t.getTurnaroundTime(),
                                    t.getCompletionTime()))
                            .collect(Collectors.toList())));
            averages.setText(String.format("Avg waiting %.2f | Avg turnaround %.2f | Clock %d",
                    stats.getAverageWaitingTime(), stats.getAverageTurnaroundTime(), scheduler.getClock()));
        } catch (EmptyResultException e) {
            completedList.getItems().clear();
            averages.setText("No process has completed yet | Clock " + scheduler.getClock());
        }
    }
}
