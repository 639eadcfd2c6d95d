package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution cost. Arithmetic saturates instead of overflowing.
 */
public final class Weight implements Comparable<Weight> {
    public static final Weight ZERO = new Weight(0);
    public static final Weight MAX = new Weight(Long.MAX_VALUE);

    private final long value;

    private Weight(long value) {
        this.value = value;
    }

    public static Weight of(long value) {
        if (value < 0)
            throw new IllegalArgumentException(String.format("Weight can not be negative: `%d`", value));
        return value == 0 ? ZERO : new Weight(value);
    }

    @JsonValue
    public long value() {
        return value;
    }

    public Weight add(Weight other) {
        long sum = value + other.value;
        return sum < 0 ? MAX : new Weight(sum);
    }

    public Weight saturatingSub(Weight other) {
        return value <= other.value ? ZERO : new Weight(value - other.value);
    }

    public Weight divide(long divisor) {
        return Weight.of(value / divisor);
    }

    public Weight min(Weight other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isLessThan(Weight other) {
        return value < other.value;
    }

    @Override
    public int compareTo(Weight other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Weight)) return false;
        return value == ((Weight) obj).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Weight{" + value + "}";
    }
}
