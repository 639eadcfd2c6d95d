package io.crosslane.utils;

import java.util.Arrays;

/**
 * Map key over a raw byte array, such as a trie key. The array is shared, not copied, so callers must not mutate it.
 */
public final class ByteArrayWrapper implements Comparable<ByteArrayWrapper> {
    private final byte[] data;

    public ByteArrayWrapper(byte[] data) {
        if (data == null)
            throw new IllegalArgumentException("Wrapped byte array must not be null");
        this.data = data;
    }

    public byte[] data() {
        return data;
    }

    @Override
    public int compareTo(ByteArrayWrapper other) {
        return compare(data, other.data);
    }

    // Unsigned lexicographic order, shorter array first on a common prefix
    public static int compare(byte[] left, byte[] right) {
        int common = Math.min(left.length, right.length);
        for (int i = 0; i < common; i++) {
            int diff = Byte.toUnsignedInt(left[i]) - Byte.toUnsignedInt(right[i]);
            if (diff != 0)
                return diff;
        }
        return left.length - right.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof ByteArrayWrapper)) return false;
        return Arrays.equals(data, ((ByteArrayWrapper) obj).data);
    }

    @Override
    public int hashCode() {
        // golden ratio multiplier spreads short keys better than Arrays.hashCode
        int h = 1;
        for (byte b : data)
            h = h * 0x9E3779B9 + b;
        return h;
    }

    @Override
    public String toString() {
        return "ByteArrayWrapper[" + BytesUtils.toHexString(data) + "]";
    }
}
