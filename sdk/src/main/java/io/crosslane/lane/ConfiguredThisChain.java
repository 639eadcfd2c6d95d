package io.crosslane.lane;

import io.crosslane.model.LaneId;
import io.crosslane.payload.RawOrigin;

import java.util.List;
import java.util.Set;

/**
 * Accepts messages from any submitter over the configured lanes only.
 */
public class ConfiguredThisChain implements ThisChainCapabilities {
    private final Set<LaneId> lanes;
    private final long maxPendingMessages;

    public ConfiguredThisChain(List<LaneId> lanes, long maxPendingMessages) {
        this.lanes = Set.copyOf(lanes);
        this.maxPendingMessages = maxPendingMessages;
    }

    @Override
    public boolean accepts(RawOrigin submitter, LaneId laneId) {
        return lanes.contains(laneId);
    }

    @Override
    public long maxPendingMessages() {
        return maxPendingMessages;
    }
}
