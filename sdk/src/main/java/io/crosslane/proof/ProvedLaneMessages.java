package io.crosslane.proof;

import io.crosslane.model.Message;
import io.crosslane.model.OutboundLaneData;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class ProvedLaneMessages {
    private final OutboundLaneData laneState;
    private final List<Message> messages;

    public ProvedLaneMessages(Optional<OutboundLaneData> laneState, List<Message> messages) {
        this.laneState = laneState.orElse(null);
        this.messages = Collections.unmodifiableList(messages);
    }

    public Optional<OutboundLaneData> getLaneState() {
        return Optional.ofNullable(laneState);
    }

    // Ordered by nonce, without gaps
    public List<Message> getMessages() {
        return messages;
    }
}
