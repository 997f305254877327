package ossim.kernel.process;

/**
 * Process descriptor used by the CPU scheduler.
 * Holds identity, scheduling inputs and the timing bookkeeping the
 * scheduler fills in while the task runs.
 */
public class Task {
    private final int id;
    private final String name;
    private final int priority;
    private final int burstTime;
    private final int arrivalTime;

    private TaskState state = TaskState.NEW;
    private int waitingTime = 0;
    private int turnaroundTime = 0;
    private int remainingTime;

    public Task(int id, String name, int priority, int burstTime, int arrivalTime) {
        if (burstTime <= 0) {
            throw new IllegalArgumentException("Burst time must be positive: " + burstTime);
        }
        if (arrivalTime < 0) {
            throw new IllegalArgumentException("Arrival time must be non-negative: " + arrivalTime);
        }
        this.id = id;
        this.name = name;
        this.priority = priority;
        this.burstTime = burstTime;
        this.arrivalTime = arrivalTime;
        this.remainingTime = burstTime;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public int getBurstTime() {
        return burstTime;
    }

    public int getArrivalTime() {
        return arrivalTime;
    }

    public TaskState getState() {
        return state;
    }

    public void setState(TaskState state) {
        this.state = state;
    }

    public int getWaitingTime() {
        return waitingTime;
    }

    public void setWaitingTime(int waitingTime) {
        this.waitingTime = waitingTime;
    }

    public int getTurnaroundTime() {
        return turnaroundTime;
    }

    public void setTurnaroundTime(int turnaroundTime) {
        this.turnaroundTime = turnaroundTime;
    }

    public int getRemainingTime() {
        return remainingTime;
    }

    /**
     * Consume CPU time. Remaining time never drops below zero.
     */
    public void consume(int units) {
        if (units < 0 || units > remainingTime) {
            throw new IllegalArgumentException(String.format(
                    "Cannot run PID %d for %d units (remaining %d)", id, units, remainingTime));
        }
        remainingTime -= units;
    }

    public boolean isFinished() {
        return remainingTime == 0;
    }

    public String getStatusString() {
        return String.format("PID %d [%s] state=%s priority=%d burst=%d arrival=%d remaining=%d",
                id, name, state, priority, burstTime, arrivalTime, remainingTime);
    }

    @Override
    public String toString() {
        return "Task{" + id + ", " + name + ", " + state + "}";
    }
}
