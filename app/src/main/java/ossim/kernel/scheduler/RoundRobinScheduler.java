package ossim.kernel.scheduler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import ossim.kernel.process.Task;

/**
 * Round-robin scheduler implementation.
 * Tasks are served in FIFO order, each for at most one time slice, and
 * go to the back of the queue while they still have work left.
 * Arrival times are not consulted: the clock only moves by the slices run.
 */
public class RoundRobinScheduler extends Scheduler {
    private final int timeSlice;

    public RoundRobinScheduler(int timeSlice) {
        if (timeSlice <= 0) {
            throw new IllegalArgumentException("Time quantum must be positive: " + timeSlice);
        }
        this.timeSlice = timeSlice;
    }

    @Override
    protected void schedule(CpuScheduler cpu, List<Task> batch) {
        // Admission order, not re-sorted
        Deque<Task> queue = new ArrayDeque<>(batch);

        while (!queue.isEmpty()) {
            Task task = queue.poll();

            int slice = Math.min(timeSlice, task.getRemainingTime());
            cpu.runFor(task, slice);

            if (!task.isFinished()) {
                cpu.preempt(task);
                queue.offer(task);
            } else {
                task.setTurnaroundTime(cpu.getClock() - task.getArrivalTime());
                task.setWaitingTime(task.getTurnaroundTime() - task.getBurstTime());
                cpu.complete(task);
            }
        }
    }

    public int getTimeSlice() {
        return timeSlice;
    }

    @Override
    public SchedulerType getType() {
        return SchedulerType.ROUND_ROBIN;
    }
}
