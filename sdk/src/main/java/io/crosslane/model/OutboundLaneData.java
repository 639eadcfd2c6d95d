package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.codec.BytesSerializable;
import io.crosslane.json.Views;

/**
 * State of a lane at the sending side.
 */
@JsonView(Views.Default.class)
public final class OutboundLaneData implements BytesSerializable {
    public static final OutboundLaneData DEFAULT = new OutboundLaneData(1, 0, 0);

    private final long oldestUnprunedNonce;
    private final long latestReceivedNonce;
    private final long latestGeneratedNonce;

    public OutboundLaneData(long oldestUnprunedNonce, long latestReceivedNonce, long latestGeneratedNonce) {
        if (oldestUnprunedNonce < 0 || latestReceivedNonce < 0 || latestGeneratedNonce < 0)
            throw new IllegalArgumentException("Lane nonces can not be negative.");
        if (latestReceivedNonce > latestGeneratedNonce)
            throw new IllegalArgumentException(String.format(
                    "Latest received nonce `%d` is ahead of latest generated nonce `%d`", latestReceivedNonce, latestGeneratedNonce));
        this.oldestUnprunedNonce = oldestUnprunedNonce;
        this.latestReceivedNonce = latestReceivedNonce;
        this.latestGeneratedNonce = latestGeneratedNonce;
    }

    public long getOldestUnprunedNonce() {
        return oldestUnprunedNonce;
    }

    public long getLatestReceivedNonce() {
        return latestReceivedNonce;
    }

    public long getLatestGeneratedNonce() {
        return latestGeneratedNonce;
    }

    public long pendingMessages() {
        return latestGeneratedNonce - latestReceivedNonce;
    }

    public OutboundLaneData withLatestGeneratedNonce(long nonce) {
        return new OutboundLaneData(oldestUnprunedNonce, latestReceivedNonce, nonce);
    }

    public OutboundLaneData withLatestReceivedNonce(long nonce) {
        return new OutboundLaneData(oldestUnprunedNonce, nonce, latestGeneratedNonce);
    }

    public OutboundLaneData withOldestUnprunedNonce(long nonce) {
        return new OutboundLaneData(nonce, latestReceivedNonce, latestGeneratedNonce);
    }

    @Override
    public OutboundLaneDataSerializer serializer() {
        return OutboundLaneDataSerializer.getSerializer();
    }

    @Override
    public byte[] bytes() {
        return serializer().toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutboundLaneData)) return false;
        OutboundLaneData that = (OutboundLaneData) o;
        return oldestUnprunedNonce == that.oldestUnprunedNonce
                && latestReceivedNonce == that.latestReceivedNonce
                && latestGeneratedNonce == that.latestGeneratedNonce;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(oldestUnprunedNonce) * 961 + Long.hashCode(latestReceivedNonce) * 31 + Long.hashCode(latestGeneratedNonce);
    }

    @Override
    public String toString() {
        return "OutboundLaneData{oldestUnprunedNonce=" + oldestUnprunedNonce
                + ", latestReceivedNonce=" + latestReceivedNonce
                + ", latestGeneratedNonce=" + latestGeneratedNonce + "}";
    }
}
