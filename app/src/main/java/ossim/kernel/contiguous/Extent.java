package ossim.kernel.contiguous;

/**
 * A contiguous run of the simulated address space, either free or owned by
 * one process. Immutable: the manager rebuilds its extent list on change.
 */
public final class Extent {
    public static final int NO_OWNER = -1;

    private final int start;
    private final int size;
    private final boolean free;
    private final int ownerPid;

    private Extent(int start, int size, boolean free, int ownerPid) {
        this.start = start;
        this.size = size;
        this.free = free;
        this.ownerPid = ownerPid;
    }

    public static Extent free(int start, int size) {
        return new Extent(start, size, true, NO_OWNER);
    }

    public static Extent allocated(int start, int size, int pid) {
        return new Extent(start, size, false, pid);
    }

    public int getStart() {
        return start;
    }

    public int getSize() {
        return size;
    }

    /** Exclusive end address. */
    public int getEnd() {
        return start + size;
    }

    public boolean isFree() {
        return free;
    }

    /**
     * Owning PID, or {@link #NO_OWNER} for a free extent.
     */
    public int getOwnerPid() {
        return ownerPid;
    }

    public boolean contains(int address) {
        return address >= start && address < start + size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Extent))
            return false;
        Extent other = (Extent) o;
        return start == other.start && size == other.size
                && free == other.free && ownerPid == other.ownerPid;
    }

    @Override
    public int hashCode() {
        int h = start;
        h = 31 * h + size;
        h = 31 * h + (free ? 1 : 0);
        return 31 * h + ownerPid;
    }

    @Override
    public String toString() {
        String status = free ? "FREE" : "P" + ownerPid;
        return String.format("[%4d-%4d] %4d %s", start, getEnd(), size, status);
    }
}
