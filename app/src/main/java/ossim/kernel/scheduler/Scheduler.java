package ossim.kernel.scheduler;

import java.util.List;

import ossim.kernel.process.Task;

/**
 * Abstract base class for all dispatch policies.
 * A policy decides the order and length of dispatches; the {@link CpuScheduler}
 * owns the clock and the bookkeeping.
 */
public abstract class Scheduler {

    /**
     * Run every task of {@code batch} to completion.
     *
     * @param cpu   scheduler whose clock and completed collection are updated
     * @param batch tasks taken from the ready collection, in admission order
     */
    protected abstract void schedule(CpuScheduler cpu, List<Task> batch);

    public abstract SchedulerType getType();
}
