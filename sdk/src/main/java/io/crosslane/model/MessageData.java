package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.codec.BytesSerializable;
import io.crosslane.json.Views;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Stored message: the fee paid at the source chain and the opaque payload.
 */
@JsonView(Views.Default.class)
public final class MessageData implements BytesSerializable {
    private final BigInteger fee;
    private final byte[] payload;

    public MessageData(BigInteger fee, byte[] payload) {
        this.fee = Objects.requireNonNull(fee, "Fee must be defined.");
        if (fee.signum() < 0)
            throw new IllegalArgumentException(String.format("Fee can not be negative: `%s`", fee));
        this.payload = Objects.requireNonNull(payload, "Payload must be defined.");
    }

    public BigInteger getFee() {
        return fee;
    }

    @JsonView(Views.Extended.class)
    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    @Override
    public MessageDataSerializer serializer() {
        return MessageDataSerializer.getSerializer();
    }

    @Override
    public byte[] bytes() {
        return serializer().toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageData)) return false;
        MessageData that = (MessageData) o;
        return fee.equals(that.fee) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * fee.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "MessageData{fee=" + fee + ", payloadSize=" + payload.length + "}";
    }
}
