package io.crosslane.dispatch;

public class CallValidationException extends Exception {
    public CallValidationException(String message) {
        super(message);
    }
}
