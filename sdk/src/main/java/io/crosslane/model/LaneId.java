package io.crosslane.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.crosslane.utils.FixedSizeByteArray;

import java.nio.charset.StandardCharsets;

@JsonSerialize(using = ToStringSerializer.class)
public final class LaneId extends FixedSizeByteArray {
    public static final int LENGTH = 4;

    public LaneId(byte[] bytes) {
        super(LENGTH, bytes);
    }

    public static LaneId fromName(String name) {
        return new LaneId(name.getBytes(StandardCharsets.US_ASCII));
    }
}
