package ossim.kernel;

import java.io.PrintStream;
import java.util.List;

import ossim.kernel.contiguous.Extent;
import ossim.kernel.process.Task;
import ossim.kernel.resource.ResourceVector;

/**
 * Prints simulation events as console status lines.
 */
public class ConsoleTraceListener implements SimulationListener {
    private final PrintStream out;

    public ConsoleTraceListener() {
        this(System.out);
    }

    public ConsoleTraceListener(PrintStream out) {
        this.out = out;
    }

    @Override
    public void taskAdmitted(Task task, int clock) {
        out.printf("[Time %d] Process %s (PID: %d) added to ready queue%n", clock, task.getName(), task.getId());
    }

    @Override
    public void taskDispatched(Task task, int startTime, int duration) {
        out.printf("[Time %d] Running %s for %d units%n", startTime, task.getName(), duration);
    }

    @Override
    public void cpuIdle(int fromTime, int toTime) {
        out.printf("[Time %d] CPU idle until %d%n", fromTime, toTime);
    }

    @Override
    public void taskPreempted(Task task, int clock) {
        out.printf("[Time %d] %s preempted, %d units left%n", clock, task.getName(), task.getRemainingTime());
    }

    @Override
    public void taskCompleted(Task task, int clock) {
        out.printf("[Time %d] %s terminated%n", clock, task.getName());
    }

    @Override
    public void memoryAllocated(Extent extent, boolean split) {
        out.printf("Allocated %d units to Process %d at address %d%s%n",
                extent.getSize(), extent.getOwnerPid(), extent.getStart(),
                split ? " (split at " + extent.getEnd() + ")" : "");
    }

    @Override
    public void memoryAllocationFailed(int pid, int size) {
        out.printf("Failed to allocate %d units to Process %d%n", size, pid);
    }

    @Override
    public void memoryFreed(Extent extent) {
        out.printf("Deallocated memory for Process %d [%d-%d]%n",
                extent.getOwnerPid(), extent.getStart(), extent.getEnd());
    }

    @Override
    public void extentsCoalesced(int mergedCount) {
        out.printf("Coalesced %d free extent(s)%n", mergedCount);
    }

    @Override
    public void memoryCompacted(int freeStart, int freeSize) {
        out.printf("Compacted memory, %d units free at address %d%n", freeSize, freeStart);
    }

    @Override
    public void processFinished(int process, ResourceVector work) {
        out.printf("P%d can finish, work = %s%n", process, work);
    }

    @Override
    public void deadlockDetected(List<Integer> deadlocked) {
        out.printf("Deadlocked processes: %s%n", deadlocked);
    }

    @Override
    public void headMoved(int from, int to, int distance) {
        out.printf("Move from %d to %d (seek: %d)%n", from, to, distance);
    }
}
