package io.crosslane.errors;

/**
 * Error codes reported by the bridge. Codes are stable and show up in events and logs.
 */
public enum BridgeError {
    // header pool
    ANCIENT_HEADER,
    KNOWN_HEADER,
    HEADER_TOO_FAR_IN_FUTURE,
    UNKNOWN_HEADER,

    // inbound lane
    DUPLICATE_MESSAGE,
    OUT_OF_ORDER_NONCE,
    TOO_MANY_UNREWARDED_RELAYERS,
    TOO_MANY_UNCONFIRMED_MESSAGES,
    TOO_MANY_MESSAGES_IN_PROOF,
    INVALID_DISPATCH_WEIGHT,

    // dispatch
    MESSAGE_REJECTED,
    VERSION_MISMATCH,
    DECODE_FAILURE,
    SIGNATURE_MISMATCH,
    ORIGIN_REJECTED,
    WEIGHT_MISMATCH,
    FEE_PAYMENT_FAILED,

    // proofs
    PROOF_EMPTY,
    PROOF_COUNT_MISMATCH,
    PROOF_MISSING_MESSAGE,
    PROOF_DECODE_FAILURE,
    PROOF_ROOT_MISMATCH,

    // outbound lane
    MESSAGE_REJECTED_BY_LANE,
    TOO_MANY_PENDING_MESSAGES,
    TOO_LOW_FEE,
    FEE_MARKET_NOT_READY,
    MESSAGE_TOO_LARGE,
    INVALID_DELIVERY_CONFIRMATION,

    // fee market
    SLASH_TRANSFER_FAILED
}
