package ossim.exception;

/**
 * No single free extent can hold the requested size.
 * The caller may retry after other processes release memory.
 */
public class InsufficientMemoryException extends SimulationException {
    private final int requestedSize;
    private final int largestFreeExtent;

    public InsufficientMemoryException(int pid, int requestedSize, int largestFreeExtent) {
        super(String.format("Cannot allocate %d units to PID %d (largest free extent: %d)",
                requestedSize, pid, largestFreeExtent));
        this.requestedSize = requestedSize;
        this.largestFreeExtent = largestFreeExtent;
    }

    public int getRequestedSize() {
        return requestedSize;
    }

    public int getLargestFreeExtent() {
        return largestFreeExtent;
    }
}
