package io.crosslane.codec;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import com.google.common.primitives.Shorts;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;

/**
 * Big-endian binary writer. Variable size fields are prefixed with their length as a 4 bytes int.
 */
public final class BytesWriter {
    private final ByteArrayOutputStream stream = new ByteArrayOutputStream();

    public BytesWriter putByte(byte value) {
        stream.write(value);
        return this;
    }

    public BytesWriter putBoolean(boolean value) {
        return putByte(value ? (byte) 1 : (byte) 0);
    }

    public BytesWriter putShort(short value) {
        stream.writeBytes(Shorts.toByteArray(value));
        return this;
    }

    public BytesWriter putInt(int value) {
        stream.writeBytes(Ints.toByteArray(value));
        return this;
    }

    public BytesWriter putLong(long value) {
        stream.writeBytes(Longs.toByteArray(value));
        return this;
    }

    // Raw bytes, no length prefix
    public BytesWriter putBytes(byte[] value) {
        stream.writeBytes(value);
        return this;
    }

    public BytesWriter putVarBytes(byte[] value) {
        putInt(value.length);
        return putBytes(value);
    }

    // Non negative amount, two's complement big-endian representation
    public BytesWriter putBalance(BigInteger value) {
        if (value.signum() < 0)
            throw new IllegalArgumentException(String.format("Balance can not be negative: `%s`", value));
        return putVarBytes(value.toByteArray());
    }

    public byte[] toBytes() {
        return stream.toByteArray();
    }
}
