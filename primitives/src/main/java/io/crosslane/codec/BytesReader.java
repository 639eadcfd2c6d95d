package io.crosslane.codec;

import io.crosslane.utils.BytesUtils;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Counterpart of {@link BytesWriter}. Every read past the end of the input throws {@link IllegalArgumentException}.
 */
public final class BytesReader {
    static final int MAX_VAR_BYTES_LENGTH = 16 * 1024 * 1024;

    private final byte[] bytes;
    private int offset;

    public BytesReader(byte[] bytes) {
        this.bytes = bytes;
        this.offset = 0;
    }

    public int remaining() {
        return bytes.length - offset;
    }

    public byte getByte() {
        require(1);
        return bytes[offset++];
    }

    public boolean getBoolean() {
        byte value = getByte();
        if (value != 0 && value != 1)
            throw new IllegalArgumentException(String.format("Input data corrupted: invalid boolean value `%d`", value));
        return value == 1;
    }

    public short getShort() {
        require(2);
        short value = BytesUtils.getShort(bytes, offset);
        offset += 2;
        return value;
    }

    public int getInt() {
        require(4);
        int value = BytesUtils.getInt(bytes, offset);
        offset += 4;
        return value;
    }

    public long getLong() {
        require(8);
        long value = BytesUtils.getLong(bytes, offset);
        offset += 8;
        return value;
    }

    public byte[] getBytes(int length) {
        if (length < 0)
            throw new IllegalArgumentException(String.format("Input data corrupted: negative length `%d`", length));
        require(length);
        byte[] value = Arrays.copyOfRange(bytes, offset, offset + length);
        offset += length;
        return value;
    }

    public byte[] getVarBytes() {
        int length = getInt();
        if (length > MAX_VAR_BYTES_LENGTH)
            throw new IllegalArgumentException(String.format("Input data corrupted: length `%d` exceeds limit", length));
        return getBytes(length);
    }

    public BigInteger getBalance() {
        byte[] value = getVarBytes();
        if (value.length == 0)
            throw new IllegalArgumentException("Input data corrupted: empty balance");
        BigInteger balance = new BigInteger(value);
        if (balance.signum() < 0)
            throw new IllegalArgumentException("Input data corrupted: negative balance");
        return balance;
    }

    public void ensureFullyConsumed() {
        if (remaining() != 0)
            throw new IllegalArgumentException(String.format("Input data corrupted: %d trailing bytes", remaining()));
    }

    private void require(int length) {
        if (remaining() < length)
            throw new IllegalArgumentException(
                    String.format("Input data corrupted: need %d bytes, %d remaining", length, remaining()));
    }
}
