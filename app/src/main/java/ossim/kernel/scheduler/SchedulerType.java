package ossim.kernel.scheduler;

public enum SchedulerType {
    FCFS("First Come First Served"),
    SJF("Shortest Job First"),
    PRIORITY("Priority"),
    ROUND_ROBIN("Round Robin");

    private final String displayName;

    SchedulerType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
