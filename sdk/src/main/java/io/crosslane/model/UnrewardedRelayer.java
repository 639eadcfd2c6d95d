package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;

import java.util.Objects;

/**
 * Relayer that has delivered a range of messages and has not been rewarded for them yet.
 */
@JsonView(Views.Default.class)
public final class UnrewardedRelayer {
    private final AccountId relayer;
    private final DeliveredMessages messages;

    public UnrewardedRelayer(AccountId relayer, DeliveredMessages messages) {
        this.relayer = Objects.requireNonNull(relayer);
        this.messages = Objects.requireNonNull(messages);
    }

    public AccountId getRelayer() {
        return relayer;
    }

    public DeliveredMessages getMessages() {
        return messages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnrewardedRelayer)) return false;
        UnrewardedRelayer that = (UnrewardedRelayer) o;
        return relayer.equals(that.relayer) && messages.equals(that.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relayer, messages);
    }

    @Override
    public String toString() {
        return "UnrewardedRelayer{relayer=" + relayer + ", messages=" + messages + "}";
    }
}
