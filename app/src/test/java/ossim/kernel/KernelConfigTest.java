package ossim.kernel;

import ossim.kernel.contiguous.AllocationPolicy;
import ossim.kernel.disk.Direction;
import ossim.kernel.scheduler.SchedulerType;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class KernelConfigTest {

    @Test
    void testDefaults() {
        KernelConfig config = new KernelConfig();
        assertEquals(SchedulerType.FCFS, config.getSchedulerType());
        assertEquals(2, config.getTimeSlice());
        assertEquals(100, config.getTotalMemory());
        assertEquals(AllocationPolicy.FIRST_FIT, config.getAllocationPolicy());
        assertEquals(200, config.getTotalCylinders());
        assertEquals(Direction.INCREASING, config.getDiskDirection());
        assertTrue(config.isTrace());
    }

    @Test
    void testLoadReadsBundledProperties() {
        KernelConfig config = KernelConfig.load();
        assertEquals(SchedulerType.ROUND_ROBIN, config.getSchedulerType());
        assertEquals(2, config.getTimeSlice());
        assertEquals(100, config.getTotalMemory());
    }

    @Test
    void testApplyOverridesRecognisedKeys() throws Exception {
        Properties props = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("test-simulator.properties")) {
            assertNotNull(in);
            props.load(in);
        }

        KernelConfig config = new KernelConfig();
        config.apply(props);

        assertEquals(SchedulerType.SJF, config.getSchedulerType());
        assertEquals(4, config.getTimeSlice());
        assertEquals(256, config.getTotalMemory());
        assertEquals(AllocationPolicy.BEST_FIT, config.getAllocationPolicy());
        assertEquals(500, config.getTotalCylinders());
        assertEquals(Direction.DECREASING, config.getDiskDirection());
        assertFalse(config.isTrace());
    }

    @Test
    void testMalformedValuesFailFast() {
        KernelConfig config = new KernelConfig();

        Properties badInt = new Properties();
        badInt.setProperty("scheduler.timeSlice", "two");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> config.apply(badInt));
        assertTrue(e.getMessage().contains("scheduler.timeSlice"));

        Properties badEnum = new Properties();
        badEnum.setProperty("memory.policy", "random_fit");
        assertThrows(IllegalArgumentException.class, () -> config.apply(badEnum));

        Properties badRange = new Properties();
        badRange.setProperty("memory.total", "0");
        assertThrows(IllegalArgumentException.class, () -> config.apply(badRange));

        assertThrows(IllegalArgumentException.class, () -> config.setTimeSlice(0));
        assertThrows(IllegalArgumentException.class, () -> config.setSchedulerType(null));
    }
}
