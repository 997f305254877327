package ossim.kernel.scheduler;

import java.util.List;

/**
 * Per-task waiting/turnaround figures over every completed task, with their means.
 */
public class SchedulerStats {
    private final List<TaskStats> tasks;
    private final double averageWaitingTime;
    private final double averageTurnaroundTime;
    private final int totalDispatches;
    private final int contextSwitches;

    public SchedulerStats(List<TaskStats> tasks, int totalDispatches, int contextSwitches) {
        if (tasks.isEmpty()) {
            throw new IllegalArgumentException("Statistics need at least one completed task");
        }
        this.tasks = List.copyOf(tasks);
        this.averageWaitingTime = tasks.stream().mapToInt(TaskStats::getWaitingTime).average().orElse(0);
        this.averageTurnaroundTime = tasks.stream().mapToInt(TaskStats::getTurnaroundTime).average().orElse(0);
        this.totalDispatches = totalDispatches;
        this.contextSwitches = contextSwitches;
    }

    public List<TaskStats> getTasks() {
        return tasks;
    }

    public double getAverageWaitingTime() {
        return averageWaitingTime;
    }

    public double getAverageTurnaroundTime() {
        return averageTurnaroundTime;
    }

    public int getTotalDispatches() {
        return totalDispatches;
    }

    public int getContextSwitches() {
        return contextSwitches;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("--- Scheduling Statistics ---\n");
        for (TaskStats t : tasks) {
            sb.append(t).append('\n');
        }
        sb.append(String.format("Average Waiting Time: %.2f%n", averageWaitingTime));
        sb.append(String.format("Average Turnaround Time: %.2f", averageTurnaroundTime));
        return sb.toString();
    }
}
