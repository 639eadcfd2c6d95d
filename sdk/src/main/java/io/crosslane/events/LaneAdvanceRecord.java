package io.crosslane.events;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.model.AccountId;
import io.crosslane.model.LaneId;

/**
 * Inbound lane progress made by one delivery batch.
 */
@JsonView(Views.Default.class)
public final class LaneAdvanceRecord extends BridgeEvent {
    private final LaneId laneId;
    private final AccountId relayer;
    private final long previousNonce;
    private final long lastConfirmedNonce;
    private final int skippedDuplicates;

    public LaneAdvanceRecord(LaneId laneId, AccountId relayer, long previousNonce, long lastConfirmedNonce, int skippedDuplicates) {
        this.laneId = laneId;
        this.relayer = relayer;
        this.previousNonce = previousNonce;
        this.lastConfirmedNonce = lastConfirmedNonce;
        this.skippedDuplicates = skippedDuplicates;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public AccountId getRelayer() {
        return relayer;
    }

    public long getPreviousNonce() {
        return previousNonce;
    }

    public long getLastConfirmedNonce() {
        return lastConfirmedNonce;
    }

    public int getSkippedDuplicates() {
        return skippedDuplicates;
    }

    @Override
    public String toString() {
        return "LaneAdvanceRecord{laneId=" + laneId + ", relayer=" + relayer + ", previousNonce=" + previousNonce
                + ", lastConfirmedNonce=" + lastConfirmedNonce + ", skippedDuplicates=" + skippedDuplicates + "}";
    }
}
