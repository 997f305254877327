package ossim.kernel.disk;

import java.util.Locale;

/**
 * Sweep direction of the disk head for SCAN.
 */
public enum Direction {
    /** Toward higher track numbers, reversing at the last cylinder. */
    INCREASING,
    /** Toward lower track numbers, reversing at track 0. */
    DECREASING;

    /**
     * Parse a direction name. Accepts the enum names plus "right"/"up" and
     * "left"/"down"; anything else is rejected.
     */
    public static Direction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Disk direction must not be null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "increasing":
            case "right":
            case "up":
                return INCREASING;
            case "decreasing":
            case "left":
            case "down":
                return DECREASING;
            default:
                throw new IllegalArgumentException("Unrecognized disk direction: '" + value + "'");
        }
    }
}
