package io.crosslane.payload;

import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;

public class BadOriginException extends BridgeException {
    public BadOriginException(String message) {
        super(BridgeError.ORIGIN_REJECTED, message);
    }
}
