package ossim.kernel;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

import ossim.kernel.contiguous.AllocationPolicy;
import ossim.kernel.disk.Direction;
import ossim.kernel.scheduler.SchedulerType;

/**
 * Simulation settings shared by the engines' factories and the front ends.
 */
public class KernelConfig {
    public static final String RESOURCE = "simulator.properties";

    private SchedulerType schedulerType = SchedulerType.FCFS;
    private int timeSlice = 2;
    private int totalMemory = 100;
    private AllocationPolicy allocationPolicy = AllocationPolicy.FIRST_FIT;
    private int totalCylinders = 200;
    private Direction diskDirection = Direction.INCREASING;
    private boolean trace = true;

    /**
     * Defaults overlaid with {@value #RESOURCE} from the classpath, if present.
     */
    public static KernelConfig load() {
        KernelConfig config = new KernelConfig();
        try (InputStream in = KernelConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config.apply(props);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return config;
    }

    /**
     * Overlay the recognised keys of {@code props}; absent keys keep their value.
     */
    public void apply(Properties props) {
        String v;
        if ((v = props.getProperty("scheduler.type")) != null) {
            setSchedulerType(parseEnum(SchedulerType.class, "scheduler.type", v));
        }
        if ((v = props.getProperty("scheduler.timeSlice")) != null) {
            setTimeSlice(parseInt("scheduler.timeSlice", v));
        }
        if ((v = props.getProperty("memory.total")) != null) {
            setTotalMemory(parseInt("memory.total", v));
        }
        if ((v = props.getProperty("memory.policy")) != null) {
            setAllocationPolicy(parseEnum(AllocationPolicy.class, "memory.policy", v));
        }
        if ((v = props.getProperty("disk.cylinders")) != null) {
            setTotalCylinders(parseInt("disk.cylinders", v));
        }
        if ((v = props.getProperty("disk.direction")) != null) {
            setDiskDirection(Direction.parse(v));
        }
        if ((v = props.getProperty("trace.enabled")) != null) {
            setTrace(Boolean.parseBoolean(v.trim()));
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
        }
    }

    public SchedulerType getSchedulerType() {
        return schedulerType;
    }

    public void setSchedulerType(SchedulerType schedulerType) {
        if (schedulerType == null) {
            throw new IllegalArgumentException("Scheduler type must not be null");
        }
        this.schedulerType = schedulerType;
    }

    public int getTimeSlice() {
        return timeSlice;
    }

    public void setTimeSlice(int timeSlice) {
        if (timeSlice <= 0) {
            throw new IllegalArgumentException("Time slice must be positive: " + timeSlice);
        }
        this.timeSlice = timeSlice;
    }

    public int getTotalMemory() {
        return totalMemory;
    }

    public void setTotalMemory(int totalMemory) {
        if (totalMemory <= 0) {
            throw new IllegalArgumentException("Total memory must be positive: " + totalMemory);
        }
        this.totalMemory = totalMemory;
    }

    public AllocationPolicy getAllocationPolicy() {
        return allocationPolicy;
    }

    public void setAllocationPolicy(AllocationPolicy allocationPolicy) {
        if (allocationPolicy == null) {
            throw new IllegalArgumentException("Allocation policy must not be null");
        }
        this.allocationPolicy = allocationPolicy;
    }

    public int getTotalCylinders() {
        return totalCylinders;
    }

    public void setTotalCylinders(int totalCylinders) {
        if (totalCylinders <= 0) {
            throw new IllegalArgumentException("Cylinder count must be positive: " + totalCylinders);
        }
        this.totalCylinders = totalCylinders;
    }

    public Direction getDiskDirection() {
        return diskDirection;
    }

    public void setDiskDirection(Direction diskDirection) {
        if (diskDirection == null) {
            throw new IllegalArgumentException("Disk direction must not be null");
        }
        this.diskDirection = diskDirection;
    }

    public boolean isTrace() {
        return trace;
    }

    public void setTrace(boolean trace) {
        this.trace = trace;
    }
}
