package ossim.kernel.deadlock;

import java.util.List;

import ossim.kernel.resource.ResourceVector;

/**
 * Verdict of a safety check. An UNSAFE verdict is a normal outcome and
 * carries the processes that could not finish.
 */
public final class SafetyResult {

    public enum Verdict {
        SAFE,
        UNSAFE
    }

    private final Verdict verdict;
    private final List<Integer> safeSequence;
    private final List<Integer> deadlocked;
    private final List<ResourceVector> need;

    SafetyResult(Verdict verdict, List<Integer> safeSequence, List<Integer> deadlocked,
            List<ResourceVector> need) {
        this.verdict = verdict;
        this.safeSequence = List.copyOf(safeSequence);
        this.deadlocked = List.copyOf(deadlocked);
        this.need = List.copyOf(need);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isSafe() {
        return verdict == Verdict.SAFE;
    }

    /**
     * Processes in the order they were marked finished. For an UNSAFE verdict
     * this is the prefix that could finish before the search stalled.
     */
    public List<Integer> getSafeSequence() {
        return safeSequence;
    }

    /**
     * Indices of unfinished processes; empty when SAFE.
     */
    public List<Integer> getDeadlocked() {
        return deadlocked;
    }

    public List<ResourceVector> getNeed() {
        return need;
    }

    @Override
    public String toString() {
        return isSafe()
                ? "SAFE, sequence " + safeSequence
                : "UNSAFE, deadlocked " + deadlocked;
    }
}
