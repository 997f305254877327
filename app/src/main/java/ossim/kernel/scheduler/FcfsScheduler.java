package ossim.kernel.scheduler;

import java.util.Comparator;

import ossim.kernel.process.Task;

/**
 * First-come-first-served: arrival time ascending.
 */
public class FcfsScheduler extends NonPreemptiveScheduler {

    @Override
    protected Comparator<Task> order() {
        return Comparator.comparingInt(Task::getArrivalTime);
    }

    @Override
    public SchedulerType getType() {
        return SchedulerType.FCFS;
    }
}
