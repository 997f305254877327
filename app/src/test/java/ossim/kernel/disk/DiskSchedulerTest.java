package ossim.kernel.disk;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FCFS and SCAN head scheduling
 */
public class DiskSchedulerTest {

    private static final List<Integer> REQUESTS = List.of(98, 183, 37, 122, 14, 124, 65, 67);

    private DiskScheduler disk;

    @BeforeEach
    void setUp() {
        disk = new DiskScheduler(200);
    }

    private static int seekAlong(int head, List<Integer> path) {
        int total = 0;
        int current = head;
        for (int track : path) {
            total += Math.abs(track - current);
            current = track;
        }
        return total;
    }

    @Test
    void testFcfsServesInInputOrder() {
        SeekResult result = disk.fcfs(REQUESTS, 53);

        assertEquals(REQUESTS, result.getSequence());
        assertEquals(640, result.getTotalSeek());
        assertEquals(53, result.getHeadStart());
        assertEquals("FCFS", result.getPolicy());
    }

    @Test
    void testScanIncreasing() {
        SeekResult result = disk.scan(REQUESTS, 53, Direction.INCREASING);

        List<Integer> expected = List.of(65, 67, 98, 122, 124, 183, 199, 37, 14);
        assertEquals(expected, result.getSequence());
        assertEquals(seekAlong(53, expected), result.getTotalSeek());
        assertEquals(331, result.getTotalSeek());
        assertEquals("SCAN", result.getPolicy());
    }

    @Test
    void testScanDecreasing() {
        SeekResult result = disk.scan(REQUESTS, 53, Direction.DECREASING);

        assertEquals(List.of(37, 14, 0, 65, 67, 98, 122, 124, 183), result.getSequence());
        assertEquals(236, result.getTotalSeek());
    }

    @Test
    void testScanPutsHeadTrackInRightSet() {
        SeekResult result = disk.scan(List.of(50, 40), 50, Direction.INCREASING);

        assertEquals(List.of(50, 199, 40), result.getSequence());
        assertEquals(308, result.getTotalSeek());
    }

    @Test
    void testScanVisitsBoundaryEvenWithoutRequests() {
        SeekResult result = disk.scan(List.of(), 53, Direction.INCREASING);

        assertEquals(List.of(199), result.getSequence());
        assertEquals(146, result.getTotalSeek());
    }

    @Test
    void testDirectionParsing() {
        assertEquals(Direction.INCREASING, Direction.parse("right"));
        assertEquals(Direction.INCREASING, Direction.parse("Increasing"));
        assertEquals(Direction.DECREASING, Direction.parse("left"));
        assertEquals(Direction.DECREASING, Direction.parse("down"));
        assertThrows(IllegalArgumentException.class, () -> Direction.parse("sideways"));
        assertThrows(IllegalArgumentException.class, () -> Direction.parse(null));
        assertThrows(IllegalArgumentException.class, () -> disk.scan(REQUESTS, 53, "outward"));

        assertEquals(331, disk.scan(REQUESTS, 53, "right").getTotalSeek());
    }

    @Test
    void testTracksMustFitTheDisk() {
        assertThrows(IllegalArgumentException.class, () -> disk.fcfs(List.of(10, 200), 53));
        assertThrows(IllegalArgumentException.class, () -> disk.fcfs(List.of(-1), 53));
        assertThrows(IllegalArgumentException.class, () -> disk.scan(List.of(10), 250, Direction.INCREASING));
        assertThrows(IllegalArgumentException.class, () -> new DiskScheduler(0));
    }
}
