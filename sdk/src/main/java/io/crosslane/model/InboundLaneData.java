package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.codec.BytesSerializable;
import io.crosslane.json.Views;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * State of a lane at the receiving side.
 * Relayer entries are ordered by nonce and are dropped once the sending side confirms it has rewarded them.
 */
@JsonView(Views.Default.class)
public final class InboundLaneData implements BytesSerializable {
    public static final InboundLaneData DEFAULT = new InboundLaneData(Collections.emptyList(), 0);

    private final List<UnrewardedRelayer> relayers;
    private final long lastConfirmedNonce;

    public InboundLaneData(List<UnrewardedRelayer> relayers, long lastConfirmedNonce) {
        if (lastConfirmedNonce < 0)
            throw new IllegalArgumentException(String.format("Nonce can not be negative: `%d`", lastConfirmedNonce));
        this.relayers = Collections.unmodifiableList(new ArrayList<>(relayers));
        this.lastConfirmedNonce = lastConfirmedNonce;
    }

    public List<UnrewardedRelayer> getRelayers() {
        return relayers;
    }

    public long getLastConfirmedNonce() {
        return lastConfirmedNonce;
    }

    public long unrewardedMessagesCount() {
        return relayers.stream().mapToLong(entry -> entry.getMessages().totalMessages()).sum();
    }

    @Override
    public InboundLaneDataSerializer serializer() {
        return InboundLaneDataSerializer.getSerializer();
    }

    @Override
    public byte[] bytes() {
        return serializer().toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InboundLaneData)) return false;
        InboundLaneData that = (InboundLaneData) o;
        return lastConfirmedNonce == that.lastConfirmedNonce && relayers.equals(that.relayers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relayers, lastConfirmedNonce);
    }

    @Override
    public String toString() {
        return "InboundLaneData{relayers=" + relayers + ", lastConfirmedNonce=" + lastConfirmedNonce + "}";
    }
}
