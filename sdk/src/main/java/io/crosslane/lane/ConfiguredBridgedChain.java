package io.crosslane.lane;

import io.crosslane.model.Weight;

/**
 * Bridged chain limits taken from configuration. A message may use at most half of the weight of a delivery
 * transaction, which leaves room for the delivery itself.
 */
public class ConfiguredBridgedChain implements BridgedChainCapabilities {
    private final int maxExtrinsicSize;
    private final Weight maxExtrinsicWeight;

    public ConfiguredBridgedChain(int maxExtrinsicSize, Weight maxExtrinsicWeight) {
        this.maxExtrinsicSize = maxExtrinsicSize;
        this.maxExtrinsicWeight = maxExtrinsicWeight;
    }

    @Override
    public int maxExtrinsicSize() {
        return maxExtrinsicSize;
    }

    @Override
    public boolean verifyDispatchWeight(byte[] payload, Weight weight) {
        return !maximalIncomingMessageDispatchWeight(maxExtrinsicWeight).isLessThan(weight);
    }

    public static Weight maximalIncomingMessageDispatchWeight(Weight maxExtrinsicWeight) {
        return maxExtrinsicWeight.divide(2);
    }
}
