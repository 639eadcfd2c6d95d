package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;

import java.util.Objects;

@JsonView(Views.Default.class)
public final class Message {
    private final MessageKey key;
    private final MessageData data;

    public Message(MessageKey key, MessageData data) {
        this.key = Objects.requireNonNull(key);
        this.data = Objects.requireNonNull(data);
    }

    public MessageKey getKey() {
        return key;
    }

    public MessageData getData() {
        return data;
    }

    public long nonce() {
        return key.getNonce();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message that = (Message) o;
        return key.equals(that.key) && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, data);
    }

    @Override
    public String toString() {
        return "Message{key=" + key + ", data=" + data + "}";
    }
}
