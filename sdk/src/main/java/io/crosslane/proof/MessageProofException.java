package io.crosslane.proof;

import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;

public class MessageProofException extends BridgeException {
    public MessageProofException(BridgeError error, String message) {
        super(error, message);
    }

    public MessageProofException(BridgeError error, String message, Throwable cause) {
        super(error, message, cause);
    }
}
