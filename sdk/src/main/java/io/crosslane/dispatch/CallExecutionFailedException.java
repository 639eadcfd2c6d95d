package io.crosslane.dispatch;

/**
 * Failed call execution. State changes of the call are reverted and its whole declared weight is consumed.
 */
public class CallExecutionFailedException extends Exception {
    public CallExecutionFailedException(String message) {
        super(message);
    }

    public CallExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
