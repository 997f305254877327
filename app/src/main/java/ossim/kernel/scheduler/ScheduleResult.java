package ossim.kernel.scheduler;

import java.util.List;

/**
 * Outcome of one scheduling run: the dispatch timeline and the tasks it finished.
 */
public final class ScheduleResult {
    private final SchedulerType type;
    private final List<DispatchRecord> timeline;
    private final List<TaskStats> completed;
    private final int endTime;

    public ScheduleResult(SchedulerType type, List<DispatchRecord> timeline, List<TaskStats> completed,
            int endTime) {
        this.type = type;
        this.timeline = List.copyOf(timeline);
        this.completed = List.copyOf(completed);
        this.endTime = endTime;
    }

    public SchedulerType getType() {
        return type;
    }

    public List<DispatchRecord> getTimeline() {
        return timeline;
    }

    /**
     * Tasks in the order they terminated.
     */
    public List<TaskStats> getCompleted() {
        return completed;
    }

    public int getEndTime() {
        return endTime;
    }
}
