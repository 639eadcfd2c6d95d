package io.crosslane.model;

import java.math.BigInteger;

/**
 * Fraction in parts per billion. Multiplication rounds down.
 */
public final class Ratio {
    public static final long ACCURACY = 1_000_000_000L;
    private static final BigInteger BIG_ACCURACY = BigInteger.valueOf(ACCURACY);

    public static final Ratio ZERO = new Ratio(0);
    public static final Ratio ONE = new Ratio(ACCURACY);

    private final long parts;

    private Ratio(long parts) {
        this.parts = parts;
    }

    public static Ratio fromParts(long parts) {
        if (parts < 0 || parts > ACCURACY)
            throw new IllegalArgumentException(String.format("Ratio parts must be in [0, %d], got `%d`", ACCURACY, parts));
        return new Ratio(parts);
    }

    public static Ratio fromPercent(int percent) {
        if (percent < 0 || percent > 100)
            throw new IllegalArgumentException(String.format("Percent must be in [0, 100], got `%d`", percent));
        return new Ratio(percent * (ACCURACY / 100));
    }

    public long parts() {
        return parts;
    }

    public BigInteger mulFloor(BigInteger amount) {
        return amount.multiply(BigInteger.valueOf(parts)).divide(BIG_ACCURACY);
    }

    public Ratio add(Ratio other) {
        return fromParts(parts + other.parts);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Ratio)) return false;
        return parts == ((Ratio) obj).parts;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(parts);
    }

    @Override
    public String toString() {
        return String.format("Ratio{%d/%d}", parts, ACCURACY);
    }
}
