package io.crosslane.utils;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;

public final class BytesUtils {
    private BytesUtils() {}

    private static void checkBounds(byte[] bytes, int offset, int size) {
        if (offset < 0 || bytes.length - offset < size)
            throw new IllegalArgumentException(String.format(
                    "Can not read %d bytes at offset %d of an array of %d bytes", size, offset, bytes.length));
    }

    // Big-endian values read in place, without copying the array
    public static short getShort(byte[] bytes, int offset) {
        checkBounds(bytes, offset, Shorts.BYTES);
        return Shorts.fromBytes(bytes[offset], bytes[offset + 1]);
    }

    public static int getInt(byte[] bytes, int offset) {
        checkBounds(bytes, offset, Ints.BYTES);
        return Ints.fromBytes(bytes[offset], bytes[offset + 1], bytes[offset + 2], bytes[offset + 3]);
    }

    public static long getLong(byte[] bytes, int offset) {
        checkBounds(bytes, offset, Longs.BYTES);
        return Longs.fromBytes(bytes[offset], bytes[offset + 1], bytes[offset + 2], bytes[offset + 3],
                bytes[offset + 4], bytes[offset + 5], bytes[offset + 6], bytes[offset + 7]);
    }

    public static byte[] concat(byte[]... chunks) {
        return Bytes.concat(chunks);
    }

    // Lowercase hex without prefix
    public static String toHexString(byte[] bytes) {
        return Converter.toHexString(bytes);
    }
}
