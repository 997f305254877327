package ossim.kernel.scheduler;

import ossim.kernel.process.Task;

/**
 * Timing figures of a terminated task, copied out of its descriptor.
 */
public final class TaskStats {
    private final int pid;
    private final String name;
    private final int arrivalTime;
    private final int burstTime;
    private final int completionTime;
    private final int waitingTime;
    private final int turnaroundTime;

    public TaskStats(int pid, String name, int arrivalTime, int burstTime,
            int completionTime, int waitingTime, int turnaroundTime) {
        this.pid = pid;
        this.name = name;
        this.arrivalTime = arrivalTime;
        this.burstTime = burstTime;
        this.completionTime = completionTime;
        this.waitingTime = waitingTime;
        this.turnaroundTime = turnaroundTime;
    }

    static TaskStats of(Task task, int completionTime) {
        return new TaskStats(task.getId(), task.getName(), task.getArrivalTime(), task.getBurstTime(),
                completionTime, task.getWaitingTime(), task.getTurnaroundTime());
    }

    public int getPid() {
        return pid;
    }

    public String getName() {
        return name;
    }

    public int getArrivalTime() {
        return arrivalTime;
    }

    public int getBurstTime() {
        return burstTime;
    }

    public int getCompletionTime() {
        return completionTime;
    }

    public int getWaitingTime() {
        return waitingTime;
    }

    public int getTurnaroundTime() {
        return turnaroundTime;
    }

    @Override
    public String toString() {
        return String.format("%s: Waiting=%d, Turnaround=%d", name, waitingTime, turnaroundTime);
    }
}
