package io.crosslane.lane;

import io.crosslane.errors.BridgeError;

/**
 * Delivery confirmation contradicting the state of the outbound lane.
 */
public class DeliveryConfirmationException extends LaneException {
    public enum Reason {
        FAILED_TO_CONFIRM_FUTURE_MESSAGES,
        EMPTY_UNREWARDED_RELAYER_ENTRY,
        NON_CONSECUTIVE_UNREWARDED_RELAYER_ENTRIES,
        TRYING_TO_CONFIRM_MORE_MESSAGES_THAN_EXPECTED
    }

    private final Reason reason;

    public DeliveryConfirmationException(Reason reason, String message) {
        super(BridgeError.INVALID_DELIVERY_CONFIRMATION, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
