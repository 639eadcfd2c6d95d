package io.crosslane.errors;

/**
 * Failure of a whole bridge call. Nothing has been applied to the ledger when it is thrown.
 */
public class BridgeException extends Exception {
    private final BridgeError error;

    public BridgeException(BridgeError error, String message) {
        super(message);
        this.error = error;
    }

    public BridgeException(BridgeError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public BridgeError getError() {
        return error;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{error=" + error + ", message=" + getMessage() + "}";
    }
}
