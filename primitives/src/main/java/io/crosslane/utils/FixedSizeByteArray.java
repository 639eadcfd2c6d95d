package io.crosslane.utils;

import java.util.Arrays;

/**
 * Immutable byte array of a fixed length. Base class of hashes and identifiers, rendered as 0x-prefixed hex.
 * Instances of different subclasses are never equal, even with the same bytes.
 */
public abstract class FixedSizeByteArray implements Comparable<FixedSizeByteArray> {
    private static final String PREFIX = "0x";

    private final byte[] bytes;

    protected FixedSizeByteArray(int length, byte[] bytes) {
        if (bytes == null || bytes.length != length)
            throw new IllegalArgumentException(String.format("%s must be %d bytes long, got %d",
                    getClass().getSimpleName(), length, bytes == null ? 0 : bytes.length));
        this.bytes = Arrays.copyOf(bytes, length);
    }

    protected FixedSizeByteArray(int length, String hex) {
        this(length, decodePrefixed(hex));
    }

    private static byte[] decodePrefixed(String hex) {
        if (hex == null || !hex.startsWith(PREFIX))
            throw new IllegalArgumentException(String.format("Hex string `%s` must be prefixed with %s", hex, PREFIX));
        return Converter.fromHexString(hex);
    }

    public byte[] toBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public String toString() {
        return Converter.toPrefixedHexString(bytes);
    }

    @Override
    public int compareTo(FixedSizeByteArray other) {
        return ByteArrayWrapper.compare(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(bytes, ((FixedSizeByteArray) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }
}
