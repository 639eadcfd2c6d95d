package io.crosslane.dispatch;

/**
 * Stages a message goes through while being dispatched, in order.
 * A rejected message stops at the last stage it has passed.
 */
public enum DispatchStage {
    RECEIVED,
    VERSION_CHECKED,
    DECODED,
    ORIGIN_DERIVED,
    CALL_VALIDATED,
    WEIGHT_CHECKED,
    FEE_PAID,
    DISPATCHED
}
