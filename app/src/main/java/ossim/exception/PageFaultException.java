package ossim.exception;

public class PageFaultException extends SimulationException {
    private final int pageNumber;

    public PageFaultException(int logicalAddress, int pageNumber) {
        super(String.format("Page fault: logical address %d -> page %d not in memory",
                logicalAddress, pageNumber));
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
