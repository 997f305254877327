package ossim.kernel;

import java.util.List;

import ossim.kernel.contiguous.Extent;
import ossim.kernel.process.Task;
import ossim.kernel.resource.ResourceVector;

/**
 * Optional observer for per-step simulation events.
 * Engines run identically with or without a listener attached;
 * every callback defaults to a no-op.
 */
public interface SimulationListener {

    SimulationListener NONE = new SimulationListener() {
    };

    // --- CPU scheduler ---

    default void taskAdmitted(Task task, int clock) {
    }

    default void taskDispatched(Task task, int startTime, int duration) {
    }

    default void cpuIdle(int fromTime, int toTime) {
    }

    default void taskPreempted(Task task, int clock) {
    }

    default void taskCompleted(Task task, int clock) {
    }

    // --- Contiguous memory ---

    default void memoryAllocated(Extent extent, boolean split) {
    }

    default void memoryAllocationFailed(int pid, int size) {
    }

    default void memoryFreed(Extent extent) {
    }

    default void extentsCoalesced(int mergedCount) {
    }

    default void memoryCompacted(int freeStart, int freeSize) {
    }

    // --- Deadlock detection ---

    default void processFinished(int process, ResourceVector work) {
    }

    default void deadlockDetected(List<Integer> deadlocked) {
    }

    // --- Disk ---

    default void headMoved(int from, int to, int distance) {
    }
}
