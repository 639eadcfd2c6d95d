package io.crosslane.lane;

import io.crosslane.model.Weight;

/**
 * Limits of the bridged chain that outbound messages must fit in to be deliverable.
 */
public interface BridgedChainCapabilities {

    int maxExtrinsicSize();

    // Whether the bridged chain can dispatch a message with this payload and declared weight
    boolean verifyDispatchWeight(byte[] payload, Weight weight);
}
