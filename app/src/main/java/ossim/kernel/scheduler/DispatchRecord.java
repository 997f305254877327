package ossim.kernel.scheduler;

/**
 * One slice of CPU time given to a task: a bar in the Gantt chart.
 */
public final class DispatchRecord {
    private final int pid;
    private final String name;
    private final int startTime;
    private final int duration;

    public DispatchRecord(int pid, String name, int startTime, int duration) {
        this.pid = pid;
        this.name = name;
        this.startTime = startTime;
        this.duration = duration;
    }

    public int getPid() {
        return pid;
    }

    public String getName() {
        return name;
    }

    public int getStartTime() {
        return startTime;
    }

    public int getDuration() {
        return duration;
    }

    public int getEndTime() {
        return startTime + duration;
    }

    @Override
    public String toString() {
        return String.format("%s[%d-%d]", name, startTime, getEndTime());
    }
}
