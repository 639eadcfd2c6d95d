package io.crosslane.lane;

import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;

public class LaneException extends BridgeException {
    public LaneException(BridgeError error, String message) {
        super(error, message);
    }
}
