package ossim.kernel.scheduler;

import java.util.Comparator;

import ossim.kernel.process.Task;

/**
 * Priority-based scheduler implementation.
 * Tasks with higher priority values are dispatched first; each runs to completion.
 */
public class PriorityScheduler extends NonPreemptiveScheduler {

    @Override
    protected Comparator<Task> order() {
        return Comparator.comparingInt(Task::getPriority).reversed();
    }

    @Override
    public SchedulerType getType() {
        return SchedulerType.PRIORITY;
    }
}
