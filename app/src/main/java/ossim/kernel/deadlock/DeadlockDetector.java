package ossim.kernel.deadlock;

import java.util.ArrayList;
import java.util.List;

import ossim.kernel.SimulationListener;
import ossim.kernel.resource.ResourceVector;

/**
 * Banker's safety algorithm used as a detector.
 * <p>
 * Given allocation, maximum claim and available vectors, searches for an
 * order in which every process can finish. Each pass picks the lowest-index
 * unfinished process whose need fits in the current work vector, so the
 * result is reproducible for identical matrices. {@link #detect()} reads the
 * matrices without changing them.
 */
public class DeadlockDetector {
    private final int numProcesses;
    private final int numResources;
    private final SimulationListener listener;

    private final ResourceVector[] allocation;
    private final ResourceVector[] maxNeed;
    private ResourceVector available;

    public DeadlockDetector(int numProcesses, int numResources) {
        this(numProcesses, numResources, SimulationListener.NONE);
    }

    public DeadlockDetector(int numProcesses, int numResources, SimulationListener listener) {
        if (numProcesses < 0 || numResources < 0) {
            throw new IllegalArgumentException(String.format(
                    "Matrix dimensions must be non-negative: %d x %d", numProcesses, numResources));
        }
        this.numProcesses = numProcesses;
        this.numResources = numResources;
        this.listener = listener;
        this.allocation = new ResourceVector[numProcesses];
        this.maxNeed = new ResourceVector[numProcesses];
        for (int p = 0; p < numProcesses; p++) {
            allocation[p] = ResourceVector.zeros(numResources);
            maxNeed[p] = ResourceVector.zeros(numResources);
        }
        this.available = ResourceVector.zeros(numResources);
    }

    /**
     * Build a detector from full matrices.
     */
    public static DeadlockDetector of(int[][] allocation, int[][] maxNeed, int[] available) {
        return of(allocation, maxNeed, available, SimulationListener.NONE);
    }

    public static DeadlockDetector of(int[][] allocation, int[][] maxNeed, int[] available,
            SimulationListener listener) {
        if (allocation.length != maxNeed.length) {
            throw new IllegalArgumentException(String.format(
                    "Allocation has %d rows but max need has %d", allocation.length, maxNeed.length));
        }
        DeadlockDetector detector = new DeadlockDetector(allocation.length, available.length, listener);
        for (int p = 0; p < allocation.length; p++) {
            detector.setAllocation(p, allocation[p]);
            detector.setMaxNeed(p, maxNeed[p]);
        }
        detector.setAvailable(available);
        return detector;
    }

    public void setAllocation(int process, int... resources) {
        allocation[checkProcess(process)] = checkRow("Allocation", resources);
    }

    public void setMaxNeed(int process, int... resources) {
        maxNeed[checkProcess(process)] = checkRow("Max need", resources);
    }

    public void setAvailable(int... resources) {
        available = checkRow("Available", resources);
    }

    public ResourceVector need(int process) {
        checkProcess(process);
        return maxNeed[process].minus(allocation[process]);
    }

    public SafetyResult detect() {
        List<ResourceVector> need = new ArrayList<>(numProcesses);
        for (int p = 0; p < numProcesses; p++) {
            need.add(maxNeed[p].minus(allocation[p]));
        }

        ResourceVector work = available;
        boolean[] finish = new boolean[numProcesses];
        List<Integer> safeSequence = new ArrayList<>(numProcesses);

        while (safeSequence.size() < numProcesses) {
            int found = -1;
            for (int p = 0; p < numProcesses; p++) {
                if (!finish[p] && need.get(p).isLessOrEqual(work)) {
                    found = p;
                    break;
                }
            }

            if (found == -1) {
                List<Integer> deadlocked = new ArrayList<>();
                for (int p = 0; p < numProcesses; p++) {
                    if (!finish[p]) {
                        deadlocked.add(p);
                    }
                }
                listener.deadlockDetected(deadlocked);
                return new SafetyResult(SafetyResult.Verdict.UNSAFE, safeSequence, deadlocked, need);
            }

            work = work.plus(allocation[found]);
            finish[found] = true;
            safeSequence.add(found);
            listener.processFinished(found, work);
        }

        return new SafetyResult(SafetyResult.Verdict.SAFE, safeSequence, List.of(), need);
    }

    private int checkProcess(int process) {
        if (process < 0 || process >= numProcesses) {
            throw new IllegalArgumentException(String.format(
                    "Process index %d outside [0, %d)", process, numProcesses));
        }
        return process;
    }

    private ResourceVector checkRow(String what, int[] resources) {
        if (resources == null || resources.length != numResources) {
            throw new IllegalArgumentException(String.format("%s row must have %d entries", what, numResources));
        }
        return ResourceVector.of(resources).requireNonNegative(what);
    }
}
