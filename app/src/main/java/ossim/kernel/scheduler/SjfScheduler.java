package ossim.kernel.scheduler;

import java.util.Comparator;

import ossim.kernel.process.Task;

/**
 * Shortest-job-first: burst time ascending, non-preemptive.
 * <p>
 * Arrival times are not consulted, so a job may run before its logical
 * arrival and report a negative waiting time. Admit a task only once it has
 * arrived to get arrival-aware behaviour.
 */
public class SjfScheduler extends NonPreemptiveScheduler {

    @Override
    protected Comparator<Task> order() {
        return Comparator.comparingInt(Task::getBurstTime);
    }

    @Override
    protected boolean waitsForArrival() {
        return false;
    }

    @Override
    public SchedulerType getType() {
        return SchedulerType.SJF;
    }
}
