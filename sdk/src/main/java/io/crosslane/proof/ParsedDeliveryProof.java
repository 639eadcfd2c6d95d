package io.crosslane.proof;

import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;

public final class ParsedDeliveryProof {
    private final LaneId laneId;
    private final InboundLaneData inboundLaneData;

    public ParsedDeliveryProof(LaneId laneId, InboundLaneData inboundLaneData) {
        this.laneId = laneId;
        this.inboundLaneData = inboundLaneData;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public InboundLaneData getInboundLaneData() {
        return inboundLaneData;
    }
}
