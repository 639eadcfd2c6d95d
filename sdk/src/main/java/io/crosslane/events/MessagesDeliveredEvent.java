package io.crosslane.events;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.LaneId;

// Messages of an outbound lane the bridged chain has confirmed receiving.
@JsonView(Views.Default.class)
public final class MessagesDeliveredEvent extends BridgeEvent {
    private final LaneId laneId;
    private final DeliveredMessages messages;

    public MessagesDeliveredEvent(LaneId laneId, DeliveredMessages messages) {
        this.laneId = laneId;
        this.messages = messages;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public DeliveredMessages getMessages() {
        return messages;
    }

    @Override
    public String toString() {
        return "MessagesDeliveredEvent{laneId=" + laneId + ", messages=" + messages + "}";
    }
}
