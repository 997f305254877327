package ossim.kernel.contiguous;

import java.util.List;

/**
 * Placement policy for contiguous allocation.
 */
public interface AllocationStrategy {
    /**
     * Pick the free extent that should receive a request.
     *
     * @param extents all extents in address order
     * @param size    requested size, positive
     * @return index into {@code extents} of a free extent with at least
     *         {@code size} units, or -1 if none qualifies
     */
    int findRegion(List<Extent> extents, int size);

    String getName();
}
