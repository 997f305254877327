package ossim.kernel.disk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ossim.kernel.SimulationListener;

/**
 * Orders a batch of track requests and totals head movement.
 * Every call is independent; the scheduler keeps no state besides its geometry.
 */
public class DiskScheduler {
    private final int totalCylinders;
    private final SimulationListener listener;

    public DiskScheduler(int totalCylinders) {
        this(totalCylinders, SimulationListener.NONE);
    }

    public DiskScheduler(int totalCylinders, SimulationListener listener) {
        if (totalCylinders <= 0) {
            throw new IllegalArgumentException("Cylinder count must be positive: " + totalCylinders);
        }
        this.totalCylinders = totalCylinders;
        this.listener = listener;
    }

    /**
     * Serve requests strictly in the given order.
     */
    public SeekResult fcfs(List<Integer> requests, int headStart) {
        validate(requests, headStart);
        return travel("FCFS", headStart, requests);
    }

    /**
     * Elevator: sweep to the end of the disk in {@code direction}, then reverse.
     * The boundary track is always visited, even when nothing lies beyond the
     * last request.
     */
    public SeekResult scan(List<Integer> requests, int headStart, Direction direction) {
        if (direction == null) {
            throw new IllegalArgumentException("Disk direction must not be null");
        }
        validate(requests, headStart);

        List<Integer> left = new ArrayList<>();
        List<Integer> right = new ArrayList<>();
        for (int track : requests) {
            if (track < headStart) {
                left.add(track);
            } else {
                right.add(track);
            }
        }
        Collections.sort(left);
        Collections.sort(right);
        Collections.reverse(left);

        List<Integer> sequence = new ArrayList<>(requests.size() + 1);
        if (direction == Direction.INCREASING) {
            sequence.addAll(right);
            sequence.add(totalCylinders - 1);
            sequence.addAll(left);
        } else {
            sequence.addAll(left);
            sequence.add(0);
            sequence.addAll(right);
        }
        return travel("SCAN", headStart, sequence);
    }

    public SeekResult scan(List<Integer> requests, int headStart, String direction) {
        return scan(requests, headStart, Direction.parse(direction));
    }

    public int getTotalCylinders() {
        return totalCylinders;
    }

    private SeekResult travel(String policy, int headStart, List<Integer> sequence) {
        int totalSeek = 0;
        int current = headStart;

        for (int track : sequence) {
            int seek = Math.abs(track - current);
            totalSeek += seek;
            listener.headMoved(current, track, seek);
            current = track;
        }
        return new SeekResult(policy, headStart, sequence, totalSeek);
    }

    private void validate(List<Integer> requests, int headStart) {
        if (requests == null) {
            throw new IllegalArgumentException("Request list must not be null");
        }
        checkTrack("Head position", headStart);
        for (Integer track : requests) {
            if (track == null) {
                throw new IllegalArgumentException("Request list must not contain null tracks");
            }
            checkTrack("Track request", track);
        }
    }

    private void checkTrack(String what, int track) {
        if (track < 0 || track >= totalCylinders) {
            throw new IllegalArgumentException(String.format(
                    "%s %d outside [0, %d)", what, track, totalCylinders));
        }
    }
}
