package io.crosslane.lane;

import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.storage.InMemoryKeyValueStore;
import io.crosslane.storage.KeyValueStore;

/**
 * Records owned by the lanes of one bridge.
 */
public final class LaneStores {
    private final KeyValueStore<LaneId, OutboundLaneData> outboundLanes;
    private final KeyValueStore<MessageKey, MessageData> outboundMessages;
    private final KeyValueStore<LaneId, InboundLaneData> inboundLanes;

    public LaneStores(KeyValueStore<LaneId, OutboundLaneData> outboundLanes,
                      KeyValueStore<MessageKey, MessageData> outboundMessages,
                      KeyValueStore<LaneId, InboundLaneData> inboundLanes) {
        this.outboundLanes = outboundLanes;
        this.outboundMessages = outboundMessages;
        this.inboundLanes = inboundLanes;
    }

    public static LaneStores inMemory() {
        return new LaneStores(new InMemoryKeyValueStore<>(), new InMemoryKeyValueStore<>(), new InMemoryKeyValueStore<>());
    }

    public KeyValueStore<LaneId, OutboundLaneData> getOutboundLanes() {
        return outboundLanes;
    }

    public KeyValueStore<MessageKey, MessageData> getOutboundMessages() {
        return outboundMessages;
    }

    public KeyValueStore<LaneId, InboundLaneData> getInboundLanes() {
        return inboundLanes;
    }
}
