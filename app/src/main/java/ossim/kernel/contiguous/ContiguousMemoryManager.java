package ossim.kernel.contiguous;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import ossim.exception.InsufficientMemoryException;
import ossim.exception.NotFoundException;
import ossim.kernel.SimulationListener;

/**
 * Contiguous memory allocation over a linear address space {@code [0, totalMemory)}.
 * <p>
 * The space is an ordered list of extents with no gaps or overlaps. After
 * every mutation no two adjacent extents are both free. Each mutation builds
 * a new list instead of editing the current one in place.
 * <p>
 * Not thread-safe; callers serialize access per instance.
 */
public class ContiguousMemoryManager {

    private final int totalMemory;
    private final AllocationStrategy allocator;
    private final SimulationListener listener;

    private List<Extent> extents;

    public ContiguousMemoryManager(int totalMemory) {
        this(totalMemory, new FirstFitStrategy());
    }

    public ContiguousMemoryManager(int totalMemory, AllocationStrategy allocator) {
        this(totalMemory, allocator, SimulationListener.NONE);
    }

    public ContiguousMemoryManager(int totalMemory, AllocationStrategy allocator, SimulationListener listener) {
        if (totalMemory <= 0) {
            throw new IllegalArgumentException("Total memory must be positive: " + totalMemory);
        }
        this.totalMemory = totalMemory;
        this.allocator = allocator;
        this.listener = listener;
        // Initially one giant free block (hole)
        this.extents = List.of(Extent.free(0, totalMemory));
    }

    /**
     * Allocate {@code size} units to {@code pid}.
     *
     * @return start address of the allocated extent
     * @throws InsufficientMemoryException if no single free extent is large enough
     */
    public int allocate(int pid, int size) throws InsufficientMemoryException {
        if (size <= 0) {
            throw new IllegalArgumentException("Allocation size must be positive: " + size);
        }
        if (pid < 0) {
            throw new IllegalArgumentException("PID must be non-negative: " + pid);
        }
        if (findOwner(pid).isPresent()) {
            throw new IllegalArgumentException("PID " + pid + " already holds an extent");
        }

        int index = allocator.findRegion(extents, size);
        if (index == -1) {
            listener.memoryAllocationFailed(pid, size);
            throw new InsufficientMemoryException(pid, size, getLargestFreeExtent());
        }

        Extent hole = extents.get(index);
        Extent taken = Extent.allocated(hole.getStart(), size, pid);
        boolean split = hole.getSize() > size;

        List<Extent> next = new ArrayList<>(extents.size() + 1);
        next.addAll(extents.subList(0, index));
        next.add(taken);
        if (split) {
            next.add(Extent.free(hole.getStart() + size, hole.getSize() - size));
        }
        next.addAll(extents.subList(index + 1, extents.size()));
        extents = Collections.unmodifiableList(next);

        listener.memoryAllocated(taken, split);
        return taken.getStart();
    }

    /**
     * Release the extent owned by {@code pid} and merge it with free neighbours.
     *
     * @return the extent as it was before being released
     */
    public Extent deallocate(int pid) throws NotFoundException {
        int index = indexOfOwner(pid);
        if (index == -1) {
            throw new NotFoundException("No memory allocated to PID " + pid);
        }

        Extent owned = extents.get(index);
        List<Extent> next = new ArrayList<>(extents);
        next.set(index, Extent.free(owned.getStart(), owned.getSize()));
        extents = Collections.unmodifiableList(next);

        listener.memoryFreed(owned);
        coalesce();
        return owned;
    }

    /**
     * Merge every maximal run of adjacent free extents into one.
     * Single left-to-right pass; running it again changes nothing.
     *
     * @return number of extents removed by merging
     */
    public int coalesce() {
        List<Extent> merged = new ArrayList<>(extents.size());
        Extent pending = null;

        for (Extent e : extents) {
            if (pending != null && pending.isFree() && e.isFree()) {
                pending = Extent.free(pending.getStart(), pending.getSize() + e.getSize());
            } else {
                if (pending != null) {
                    merged.add(pending);
                }
                pending = e;
            }
        }
        if (pending != null) {
            merged.add(pending);
        }

        int removed = extents.size() - merged.size();
        if (removed > 0) {
            extents = Collections.unmodifiableList(merged);
            listener.extentsCoalesced(removed);
        }
        return removed;
    }

    /**
     * Slide every allocated extent toward address 0, keeping their order,
     * and leave a single free extent at the top.
     */
    public void compact() {
        List<Extent> next = new ArrayList<>();
        int currentPos = 0;

        for (Extent e : extents) {
            if (!e.isFree()) {
                next.add(Extent.allocated(currentPos, e.getSize(), e.getOwnerPid()));
                currentPos += e.getSize();
            }
        }
        if (currentPos < totalMemory) {
            next.add(Extent.free(currentPos, totalMemory - currentPos));
        }
        extents = Collections.unmodifiableList(next);
        listener.memoryCompacted(currentPos, totalMemory - currentPos);
    }

    /**
     * Ordered extent list. The returned list is immutable and is not
     * affected by later operations.
     */
    public List<Extent> snapshot() {
        return extents;
    }

    public Optional<Extent> findOwner(int pid) {
        int index = indexOfOwner(pid);
        return index == -1 ? Optional.empty() : Optional.of(extents.get(index));
    }

    public int getFreeMemory() {
        return extents.stream().filter(Extent::isFree).mapToInt(Extent::getSize).sum();
    }

    public int getLargestFreeExtent() {
        return extents.stream().filter(Extent::isFree).mapToInt(Extent::getSize).max().orElse(0);
    }

    public int getTotalMemory() {
        return totalMemory;
    }

    public AllocationStrategy getStrategy() {
        return allocator;
    }

    private int indexOfOwner(int pid) {
        for (int i = 0; i < extents.size(); i++) {
            Extent e = extents.get(i);
            if (!e.isFree() && e.getOwnerPid() == pid) {
                return i;
            }
        }
        return -1;
    }
}
