package io.crosslane.dispatch;

public class CallDecodeException extends Exception {
    public CallDecodeException(String message) {
        super(message);
    }

    public CallDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
