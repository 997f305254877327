package ossim.kernel.disk;

import java.util.List;

/**
 * Order in which the head visited tracks, and the total distance travelled.
 * The visit sequence excludes the starting head position.
 */
public final class SeekResult {
    private final String policy;
    private final int headStart;
    private final List<Integer> sequence;
    private final int totalSeek;

    public SeekResult(String policy, int headStart, List<Integer> sequence, int totalSeek) {
        this.policy = policy;
        this.headStart = headStart;
        this.sequence = List.copyOf(sequence);
        this.totalSeek = totalSeek;
    }

    public String getPolicy() {
        return policy;
    }

    public int getHeadStart() {
        return headStart;
    }

    public List<Integer> getSequence() {
        return sequence;
    }

    public int getTotalSeek() {
        return totalSeek;
    }

    @Override
    public String toString() {
        return String.format("%s from %d: %s (total seek %d)", policy, headStart, sequence, totalSeek);
    }
}
