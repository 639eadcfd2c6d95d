package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;

import java.util.Objects;

/**
 * Unique id of a message: the lane it was sent over and its nonce within that lane.
 */
@JsonView(Views.Default.class)
public final class MessageKey implements Comparable<MessageKey> {
    private final LaneId laneId;
    private final long nonce;

    public MessageKey(LaneId laneId, long nonce) {
        this.laneId = Objects.requireNonNull(laneId, "Lane id must be defined.");
        if (nonce < 0)
            throw new IllegalArgumentException(String.format("Nonce can not be negative: `%d`", nonce));
        this.nonce = nonce;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public long getNonce() {
        return nonce;
    }

    @Override
    public int compareTo(MessageKey other) {
        int byLane = laneId.compareTo(other.laneId);
        return byLane != 0 ? byLane : Long.compare(nonce, other.nonce);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageKey)) return false;
        MessageKey that = (MessageKey) o;
        return nonce == that.nonce && laneId.equals(that.laneId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(laneId, nonce);
    }

    @Override
    public String toString() {
        return "MessageKey{laneId=" + laneId + ", nonce=" + nonce + "}";
    }
}
