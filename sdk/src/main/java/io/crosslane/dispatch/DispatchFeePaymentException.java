package io.crosslane.dispatch;

public class DispatchFeePaymentException extends Exception {
    public DispatchFeePaymentException(String message) {
        super(message);
    }

    public DispatchFeePaymentException(String message, Throwable cause) {
        super(message, cause);
    }
}
