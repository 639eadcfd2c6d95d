package io.crosslane.lane;

import io.crosslane.errors.BridgeError;
import io.crosslane.model.Weight;

/**
 * Checks an outbound message can ever be delivered to the bridged chain.
 */
public final class ChainMessageVerifier {
    static final String TOO_LARGE = "The message is too large to be sent over the bridge: %d bytes, at most %d";
    static final String TOO_HEAVY = "The bridged chain can not dispatch a message of weight %d";

    private final BridgedChainCapabilities bridgedChain;

    public ChainMessageVerifier(BridgedChainCapabilities bridgedChain) {
        this.bridgedChain = bridgedChain;
    }

    /**
     * Two thirds of a delivery transaction, the rest is left for the proof.
     */
    public int maximalIncomingMessageSize() {
        return bridgedChain.maxExtrinsicSize() / 3 * 2;
    }

    public void verifyChainMessage(byte[] payload, Weight weight) throws LaneException {
        if (payload.length > maximalIncomingMessageSize())
            throw new LaneException(BridgeError.MESSAGE_TOO_LARGE, String.format(TOO_LARGE, payload.length, maximalIncomingMessageSize()));
        if (!bridgedChain.verifyDispatchWeight(payload, weight))
            throw new LaneException(BridgeError.INVALID_DISPATCH_WEIGHT, String.format(TOO_HEAVY, weight.value()));
    }
}
