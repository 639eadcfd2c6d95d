package io.crosslane.events;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.model.MessageKey;

import java.math.BigInteger;

@JsonView(Views.Default.class)
public final class MessageAcceptedEvent extends BridgeEvent {
    private final MessageKey key;
    private final BigInteger fee;

    public MessageAcceptedEvent(MessageKey key, BigInteger fee) {
        this.key = key;
        this.fee = fee;
    }

    public MessageKey getKey() {
        return key;
    }

    public BigInteger getFee() {
        return fee;
    }

    @Override
    public String toString() {
        return "MessageAcceptedEvent{key=" + key + ", fee=" + fee + "}";
    }
}
