package io.crosslane.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.crosslane.utils.FixedSizeByteArray;

import java.nio.charset.StandardCharsets;

@JsonSerialize(using = ToStringSerializer.class)
public final class ChainId extends FixedSizeByteArray {
    public static final int LENGTH = 4;

    public ChainId(byte[] bytes) {
        super(LENGTH, bytes);
    }

    // Chain ids are usually given as 4 ascii characters, e.g. "pagl"
    public static ChainId fromName(String name) {
        return new ChainId(name.getBytes(StandardCharsets.US_ASCII));
    }
}
