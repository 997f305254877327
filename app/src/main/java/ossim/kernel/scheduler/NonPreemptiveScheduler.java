package ossim.kernel.scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import ossim.kernel.process.Task;

/**
 * Orders the batch once and runs each task for its whole burst.
 * The sort is stable, so ties keep admission order.
 */
public abstract class NonPreemptiveScheduler extends Scheduler {

    protected abstract Comparator<Task> order();

    /**
     * Whether the clock jumps forward to a task's arrival when the CPU
     * would otherwise start it early.
     */
    protected boolean waitsForArrival() {
        return true;
    }

    @Override
    protected void schedule(CpuScheduler cpu, List<Task> batch) {
        List<Task> ordered = new ArrayList<>(batch);
        ordered.sort(order());

        for (Task task : ordered) {
            if (waitsForArrival()) {
                cpu.idleUntil(task.getArrivalTime());
            }
            task.setWaitingTime(cpu.getClock() - task.getArrivalTime());
            cpu.runFor(task, task.getRemainingTime());
            task.setTurnaroundTime(cpu.getClock() - task.getArrivalTime());
            cpu.complete(task);
        }
    }
}
