package ossim.kernel.scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ossim.exception.EmptyResultException;
import ossim.kernel.KernelConfig;
import ossim.kernel.SimulationListener;
import ossim.kernel.process.Task;
import ossim.kernel.process.TaskState;

/**
 * CPU scheduling engine.
 * <p>
 * Holds the ready collection, the completed collection and a logical clock
 * that only moves when a task runs (or the CPU idles waiting for an arrival).
 * Each {@code run*} call consumes the whole ready collection. The clock and
 * the completed collection carry over between runs.
 * <p>
 * Not thread-safe; one instance per simulation run.
 */
public class CpuScheduler {
    private final List<Task> readyQueue = new ArrayList<>();
    private final List<Task> completed = new ArrayList<>();
    private final List<TaskStats> completedStats = new ArrayList<>();
    private final SimulationListener listener;

    private int clock = 0;

    // Statistics
    private int totalDispatches = 0;
    private int contextSwitches = 0;
    private Task lastDispatched = null;

    // Per-run accumulators
    private List<DispatchRecord> runTimeline;
    private List<TaskStats> runCompleted;

    public CpuScheduler() {
        this(SimulationListener.NONE);
    }

    public CpuScheduler(SimulationListener listener) {
        this.listener = listener;
    }

    /**
     * Build the policy selected by the configuration.
     */
    public static Scheduler createScheduler(KernelConfig config) {
        switch (config.getSchedulerType()) {
            case SJF:
                return new SjfScheduler();
            case PRIORITY:
                return new PriorityScheduler();
            case ROUND_ROBIN:
                return new RoundRobinScheduler(config.getTimeSlice());
            case FCFS:
            default:
                return new FcfsScheduler();
        }
    }

    /**
     * Move a NEW or READY task into the ready collection.
     */
    public void admit(Task task) {
        if (task.getState() != TaskState.NEW && task.getState() != TaskState.READY) {
            throw new IllegalArgumentException("Cannot admit task in state " + task.getState() + ": " + task);
        }
        if (readyQueue.contains(task)) {
            throw new IllegalArgumentException("Task already in ready queue: " + task);
        }
        task.setState(TaskState.READY);
        readyQueue.add(task);
        listener.taskAdmitted(task, clock);
    }

    public ScheduleResult runFcfs() {
        return run(new FcfsScheduler());
    }

    public ScheduleResult runSjf() {
        return run(new SjfScheduler());
    }

    public ScheduleResult runPriority() {
        return run(new PriorityScheduler());
    }

    public ScheduleResult runRoundRobin(int quantum) {
        return run(new RoundRobinScheduler(quantum));
    }

    public ScheduleResult run(KernelConfig config) {
        return run(createScheduler(config));
    }

    /**
     * Hand the whole ready collection to {@code scheduler} and run it dry.
     */
    public ScheduleResult run(Scheduler scheduler) {
        List<Task> batch = new ArrayList<>(readyQueue);
        readyQueue.clear();

        runTimeline = new ArrayList<>();
        runCompleted = new ArrayList<>();
        try {
            scheduler.schedule(this, batch);
            return new ScheduleResult(scheduler.getType(), runTimeline, runCompleted, clock);
        } finally {
            runTimeline = null;
            runCompleted = null;
        }
    }

    /**
     * Waiting/turnaround figures over every task completed so far.
     *
     * @throws EmptyResultException if nothing has completed
     */
    public SchedulerStats statistics() throws EmptyResultException {
        if (completedStats.isEmpty()) {
            throw new EmptyResultException("No process has completed yet");
        }
        return new SchedulerStats(completedStats, totalDispatches, contextSwitches);
    }

    // --- Hooks used by the policies ---

    void idleUntil(int time) {
        if (clock < time) {
            listener.cpuIdle(clock, time);
            clock = time;
        }
    }

    void runFor(Task task, int units) {
        task.setState(TaskState.RUNNING);
        int start = clock;
        listener.taskDispatched(task, start, units);

        task.consume(units);
        clock += units;

        totalDispatches++;
        if (lastDispatched != task) {
            contextSwitches++;
            lastDispatched = task;
        }
        runTimeline.add(new DispatchRecord(task.getId(), task.getName(), start, units));
    }

    void preempt(Task task) {
        task.setState(TaskState.READY);
        listener.taskPreempted(task, clock);
    }

    void complete(Task task) {
        task.setState(TaskState.TERMINATED);
        completed.add(task);
        TaskStats stats = TaskStats.of(task, clock);
        completedStats.add(stats);
        runCompleted.add(stats);
        listener.taskCompleted(task, clock);
    }

    // --- Observability ---

    public int getClock() {
        return clock;
    }

    public List<Task> getReadyTasks() {
        return Collections.unmodifiableList(readyQueue);
    }

    public List<Task> getCompletedTasks() {
        return Collections.unmodifiableList(completed);
    }

    public int getReadyQueueSize() {
        return readyQueue.size();
    }
}
