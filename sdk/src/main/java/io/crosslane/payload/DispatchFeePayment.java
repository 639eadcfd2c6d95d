package io.crosslane.payload;

import java.util.Arrays;

/**
 * Where the dispatch fee of a message is paid.
 */
public enum DispatchFeePayment {
    // included in the delivery fee paid by the sender
    AT_SOURCE_CHAIN((byte) 0),
    // withdrawn from the dispatch origin right before execution
    AT_TARGET_CHAIN((byte) 1);

    private final byte code;

    DispatchFeePayment(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static DispatchFeePayment fromCode(byte code) {
        return Arrays.stream(values())
                .filter(value -> value.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown dispatch fee payment `%d`", code)));
    }
}
