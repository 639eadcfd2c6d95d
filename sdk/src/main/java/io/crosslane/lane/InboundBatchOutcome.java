package io.crosslane.lane;

import io.crosslane.dispatch.MessageDispatchResult;
import io.crosslane.model.LaneId;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of receiving a batch of messages over an inbound lane.
 */
public final class InboundBatchOutcome {
    private final LaneId laneId;
    private final long previousNonce;
    private final long lastConfirmedNonce;
    private final List<Long> duplicateNonces;
    private final Map<Long, MessageDispatchResult> dispatchResults;

    public InboundBatchOutcome(LaneId laneId, long previousNonce, long lastConfirmedNonce,
                               List<Long> duplicateNonces, Map<Long, MessageDispatchResult> dispatchResults) {
        this.laneId = laneId;
        this.previousNonce = previousNonce;
        this.lastConfirmedNonce = lastConfirmedNonce;
        this.duplicateNonces = Collections.unmodifiableList(duplicateNonces);
        this.dispatchResults = Collections.unmodifiableMap(dispatchResults);
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public long getPreviousNonce() {
        return previousNonce;
    }

    public long getLastConfirmedNonce() {
        return lastConfirmedNonce;
    }

    // Nonces skipped because they had already been received
    public List<Long> getDuplicateNonces() {
        return duplicateNonces;
    }

    // Dispatch results by nonce, in nonce order
    public Map<Long, MessageDispatchResult> getDispatchResults() {
        return dispatchResults;
    }

    public int acceptedMessages() {
        return dispatchResults.size();
    }
}
