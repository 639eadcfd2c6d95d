package io.crosslane.lane;

import io.crosslane.model.LaneId;
import io.crosslane.payload.RawOrigin;

/**
 * Policy of the chain the ledger runs on towards outbound messages.
 */
public interface ThisChainCapabilities {

    // Whether the submitter may send messages over the lane
    boolean accepts(RawOrigin submitter, LaneId laneId);

    // Messages sent over a lane and not yet confirmed, at most
    long maxPendingMessages();
}
