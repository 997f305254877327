package ossim.kernel.resource;

import java.util.Arrays;

/**
 * Fixed-width vector of per-resource-type quantities.
 * Instances are immutable; arithmetic returns a new vector.
 * Components may be negative (a need vector can be when a claim is
 * below the current allocation).
 */
public final class ResourceVector {
    private final int[] values;

    private ResourceVector(int[] values) {
        this.values = values;
    }

    public static ResourceVector of(int... values) {
        return new ResourceVector(values.clone());
    }

    public static ResourceVector zeros(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Vector width must be non-negative: " + width);
        }
        return new ResourceVector(new int[width]);
    }

    public int size() {
        return values.length;
    }

    public int get(int resource) {
        return values[resource];
    }

    public ResourceVector plus(ResourceVector other) {
        checkWidth(other);
        int[] sum = new int[values.length];
        for (int r = 0; r < values.length; r++) {
            sum[r] = values[r] + other.values[r];
        }
        return new ResourceVector(sum);
    }

    public ResourceVector minus(ResourceVector other) {
        checkWidth(other);
        int[] diff = new int[values.length];
        for (int r = 0; r < values.length; r++) {
            diff[r] = values[r] - other.values[r];
        }
        return new ResourceVector(diff);
    }

    /**
     * Element-wise {@code this[r] <= other[r]} for every resource r.
     */
    public boolean isLessOrEqual(ResourceVector other) {
        checkWidth(other);
        for (int r = 0; r < values.length; r++) {
            if (values[r] > other.values[r]) {
                return false;
            }
        }
        return true;
    }

    public boolean isNonNegative() {
        for (int v : values) {
            if (v < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Fails with IllegalArgumentException if any component is negative.
     */
    public ResourceVector requireNonNegative(String what) {
        if (!isNonNegative()) {
            throw new IllegalArgumentException(what + " must not contain negative quantities: " + this);
        }
        return this;
    }

    public int[] toArray() {
        return values.clone();
    }

    private void checkWidth(ResourceVector other) {
        if (other.values.length != values.length) {
            throw new IllegalArgumentException(String.format(
                    "Vector width mismatch: %d vs %d", values.length, other.values.length));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResourceVector))
            return false;
        return Arrays.equals(values, ((ResourceVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
