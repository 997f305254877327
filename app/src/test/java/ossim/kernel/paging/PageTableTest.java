package ossim.kernel.paging;

import ossim.exception.PageFaultException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PageTableTest {

    private PageTable pageTable;

    @BeforeEach
    void setUp() {
        pageTable = new PageTable(4);
        assertEquals(4, pageTable.getPageSize());
        pageTable.addMapping(0, 2);
        pageTable.addMapping(1, 5);
        pageTable.addMapping(2, 1);
    }

    @Test
    void testTranslateMappedAddresses() throws Exception {
        assertEquals(8, pageTable.translate(0));
        assertEquals(23, pageTable.translate(7));
        assertEquals(6, pageTable.translate(10));
    }

    @Test
    void testUnmappedPageFaults() {
        PageFaultException fault = assertThrows(PageFaultException.class, () -> pageTable.translate(13));
        assertEquals(3, fault.getPageNumber());

        assertFalse(pageTable.isMapped(3));
        assertTrue(pageTable.isMapped(0));
        pageTable.removeMapping(0);
        assertFalse(pageTable.isMapped(0));
        assertThrows(PageFaultException.class, () -> pageTable.translate(1));
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new PageTable(0));
        assertEquals(PageTable.DEFAULT_PAGE_SIZE, new PageTable().getPageSize());
        assertThrows(IllegalArgumentException.class, () -> pageTable.translate(-1));
        assertThrows(IllegalArgumentException.class, () -> pageTable.addMapping(-1, 3));
    }
}
