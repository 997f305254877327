package ossim.kernel.paging;

import java.util.Map;
import java.util.TreeMap;

import ossim.exception.PageFaultException;

/**
 * Single-level page table mapping page numbers to frame numbers.
 */
public class PageTable {
    public static final int DEFAULT_PAGE_SIZE = 4;

    private final int pageSize;
    private final Map<Integer, Integer> table = new TreeMap<>();

    public PageTable() {
        this(DEFAULT_PAGE_SIZE);
    }

    public PageTable(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public void addMapping(int pageNumber, int frameNumber) {
        if (pageNumber < 0 || frameNumber < 0) {
            throw new IllegalArgumentException(String.format(
                    "Page and frame numbers must be non-negative: page %d, frame %d", pageNumber, frameNumber));
        }
        table.put(pageNumber, frameNumber);
    }

    public void removeMapping(int pageNumber) {
        table.remove(pageNumber);
    }

    /**
     * Translate Logical Address -> Physical Address.
     *
     * @throws PageFaultException if the page is not mapped
     */
    public int translate(int logicalAddress) throws PageFaultException {
        if (logicalAddress < 0) {
            throw new IllegalArgumentException("Logical address must be non-negative: " + logicalAddress);
        }
        int pageNumber = logicalAddress / pageSize;
        int offset = logicalAddress % pageSize;

        Integer frame = table.get(pageNumber);
        if (frame == null) {
            throw new PageFaultException(logicalAddress, pageNumber);
        }
        return frame * pageSize + offset;
    }

    public boolean isMapped(int pageNumber) {
        return table.containsKey(pageNumber);
    }

    public int getPageSize() {
        return pageSize;
    }
}
