package ossim.kernel.contiguous;

import ossim.exception.InsufficientMemoryException;
import ossim.exception.NotFoundException;
import ossim.kernel.SimulationListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for contiguous allocation, splitting and coalescing
 */
public class ContiguousMemoryManagerTest {

    private ContiguousMemoryManager mm;

    @BeforeEach
    void setUp() {
        mm = new ContiguousMemoryManager(100, new FirstFitStrategy());
    }

    /** Extents cover [0, total) with no gaps or overlaps, and no two neighbours are both free. */
    private static void assertWellFormed(ContiguousMemoryManager mm) {
        List<Extent> extents = mm.snapshot();
        assertFalse(extents.isEmpty());
        int expectedStart = 0;
        Extent previous = null;
        for (Extent e : extents) {
            assertEquals(expectedStart, e.getStart(), "Gap or overlap before " + e);
            assertTrue(e.getSize() > 0, "Empty extent " + e);
            if (previous != null) {
                assertFalse(previous.isFree() && e.isFree(), "Adjacent free extents " + previous + " / " + e);
            }
            expectedStart = e.getEnd();
            previous = e;
        }
        assertEquals(mm.getTotalMemory(), expectedStart, "Extents must end at total memory");
    }

    @Test
    void testInitialLayoutIsOneFreeExtent() {
        assertEquals(List.of(Extent.free(0, 100)), mm.snapshot());
        assertEquals(100, mm.getFreeMemory());
    }

    @Test
    void testFirstFitScenario() throws Exception {
        assertEquals(0, mm.allocate(1, 20));
        assertEquals(20, mm.allocate(2, 30));
        assertEquals(50, mm.allocate(3, 15));
        assertEquals(List.of(
                Extent.allocated(0, 20, 1),
                Extent.allocated(20, 30, 2),
                Extent.allocated(50, 15, 3),
                Extent.free(65, 35)), mm.snapshot());

        mm.deallocate(2);
        // Both neighbours are allocated: the hole stays on its own
        assertEquals(Extent.free(20, 30), mm.snapshot().get(1));
        assertEquals(4, mm.snapshot().size());
        assertWellFormed(mm);

        // First fit skips the 30-unit hole and takes the 35-unit tail exactly
        assertEquals(65, mm.allocate(4, 35));
        assertEquals(4, mm.snapshot().size(), "Exact fit must not split");

        InsufficientMemoryException ex = assertThrows(InsufficientMemoryException.class,
                () -> mm.allocate(5, 31));
        assertEquals(31, ex.getRequestedSize());
        assertEquals(30, ex.getLargestFreeExtent());
    }

    @Test
    void testExternalFragmentationFailsAllocation() throws Exception {
        mm.allocate(1, 20);
        mm.allocate(2, 30);
        mm.allocate(3, 15);
        mm.deallocate(2);
        mm.allocate(4, 31);

        // Free: 30 at [20,50) and 4 at [96,100); 34 in total but no single hole of 32
        assertEquals(34, mm.getFreeMemory());
        assertThrows(InsufficientMemoryException.class, () -> mm.allocate(5, 32));
        assertWellFormed(mm);
        assertFalse(mm.findOwner(5).isPresent(), "Failed allocation leaves no trace");
    }

    @Test
    void testDeallocateCoalescesBothSides() throws Exception {
        mm.allocate(1, 10);
        mm.allocate(2, 10);
        mm.allocate(3, 10);

        mm.deallocate(1);
        assertEquals(Extent.free(0, 10), mm.snapshot().get(0));

        mm.deallocate(3);
        assertEquals(Extent.free(20, 80), mm.snapshot().get(2), "Freed extent merges with the free tail");

        mm.deallocate(2);
        assertEquals(List.of(Extent.free(0, 100)), mm.snapshot());
    }

    @Test
    void testCoalesceIsIdempotent() throws Exception {
        mm.allocate(1, 25);
        mm.allocate(2, 25);
        mm.deallocate(1);

        List<Extent> once = mm.snapshot();
        assertEquals(0, mm.coalesce());
        assertEquals(once, mm.snapshot());
        assertEquals(0, mm.coalesce());
        assertEquals(once, mm.snapshot());
    }

    @Test
    void testRandomWorkloadKeepsInvariants() {
        Random random = new Random(42);
        List<Integer> live = new ArrayList<>();
        int nextPid = 1;

        for (int step = 0; step < 500; step++) {
            if (live.isEmpty() || random.nextBoolean()) {
                int pid = nextPid++;
                try {
                    mm.allocate(pid, 1 + random.nextInt(30));
                    live.add(pid);
                } catch (InsufficientMemoryException e) {
                    // expected under pressure
                }
            } else {
                int pid = live.remove(random.nextInt(live.size()));
                assertDoesNotThrow(() -> mm.deallocate(pid));
            }
            assertWellFormed(mm);
        }
    }

    @Test
    void testInvalidRequests() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> mm.allocate(1, 0));
        assertThrows(IllegalArgumentException.class, () -> mm.allocate(1, -5));
        assertThrows(IllegalArgumentException.class, () -> mm.allocate(-1, 5));

        mm.allocate(1, 10);
        assertThrows(IllegalArgumentException.class, () -> mm.allocate(1, 10),
                "A PID holds at most one extent");

        assertThrows(NotFoundException.class, () -> mm.deallocate(99));
        mm.deallocate(1);
        assertThrows(NotFoundException.class, () -> mm.deallocate(1));
        assertThrows(IllegalArgumentException.class, () -> new ContiguousMemoryManager(0));
    }

    @Test
    void testSnapshotIsReadOnlyAndStable() throws Exception {
        List<Extent> before = mm.snapshot();
        mm.allocate(1, 40);

        assertEquals(List.of(Extent.free(0, 100)), before, "Old snapshot must not change");
        assertThrows(UnsupportedOperationException.class, () -> mm.snapshot().clear());
    }

    private ContiguousMemoryManager fragmented(AllocationStrategy strategy) throws Exception {
        ContiguousMemoryManager m = new ContiguousMemoryManager(100, strategy);
        m.allocate(1, 25);
        m.allocate(2, 10);
        m.allocate(3, 20);
        m.allocate(4, 10);
        m.deallocate(1);
        m.deallocate(3);
        // Holes: 25 at 0, 20 at 35, 35 at 65
        return m;
    }

    @Test
    void testPlacementStrategies() throws Exception {
        assertEquals(0, fragmented(new FirstFitStrategy()).allocate(9, 15));
        assertEquals(35, fragmented(new BestFitStrategy()).allocate(9, 15));
        assertEquals(65, fragmented(new WorstFitStrategy()).allocate(9, 15));

        assertTrue(AllocationPolicy.BEST_FIT.createStrategy() instanceof BestFitStrategy);
        assertTrue(AllocationPolicy.WORST_FIT.createStrategy() instanceof WorstFitStrategy);
        assertTrue(AllocationPolicy.FIRST_FIT.createStrategy() instanceof FirstFitStrategy);
    }

    @Test
    void testCompactMovesAllocationsDown() throws Exception {
        ContiguousMemoryManager m = fragmented(new FirstFitStrategy());
        m.compact();

        assertEquals(List.of(
                Extent.allocated(0, 10, 2),
                Extent.allocated(10, 10, 4),
                Extent.free(20, 80)), m.snapshot());
        assertEquals(20, m.allocate(5, 80));
        assertWellFormed(m);
    }

    @Test
    void testCompactReportsFreeTail() throws Exception {
        List<String> events = new ArrayList<>();
        ContiguousMemoryManager m = new ContiguousMemoryManager(100, new FirstFitStrategy(),
                new SimulationListener() {
                    @Override
                    public void memoryCompacted(int freeStart, int freeSize) {
                        events.add(freeStart + "+" + freeSize);
                    }
                });
        m.allocate(1, 30);
        m.allocate(2, 70);
        m.deallocate(1);

        m.compact();
        assertEquals(List.of("70+30"), events);

        // Memory full: nothing is left at the top
        m.allocate(3, 30);
        m.compact();
        assertEquals(List.of("70+30", "100+0"), events);
        assertEquals(List.of(Extent.allocated(0, 70, 2), Extent.allocated(70, 30, 3)), m.snapshot());
    }
}
