package io.crosslane.lane;

import io.crosslane.fee.RewardSettlement;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.LaneId;

import java.util.Optional;

public final class DeliveryConfirmationOutcome {
    private final LaneId laneId;
    private final Optional<DeliveredMessages> confirmedMessages;
    private final Optional<RewardSettlement> settlement;
    private final int prunedMessages;

    public DeliveryConfirmationOutcome(LaneId laneId, Optional<DeliveredMessages> confirmedMessages,
                                       Optional<RewardSettlement> settlement, int prunedMessages) {
        this.laneId = laneId;
        this.confirmedMessages = confirmedMessages;
        this.settlement = settlement;
        this.prunedMessages = prunedMessages;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    // Empty when the proof confirms nothing new
    public Optional<DeliveredMessages> getConfirmedMessages() {
        return confirmedMessages;
    }

    public Optional<RewardSettlement> getSettlement() {
        return settlement;
    }

    public int getPrunedMessages() {
        return prunedMessages;
    }
}
