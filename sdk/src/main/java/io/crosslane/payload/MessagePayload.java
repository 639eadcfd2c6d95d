package io.crosslane.payload;

import io.crosslane.codec.BytesSerializable;
import io.crosslane.model.Weight;

import java.util.Arrays;
import java.util.Objects;

/**
 * Content of a message dispatched as a call at the target chain.
 */
public final class MessagePayload implements BytesSerializable {
    private final int specVersion;
    private final Weight weight;
    private final CallOrigin origin;
    private final DispatchFeePayment dispatchFeePayment;
    private final byte[] call;

    public MessagePayload(int specVersion, Weight weight, CallOrigin origin,
                          DispatchFeePayment dispatchFeePayment, byte[] call) {
        this.specVersion = specVersion;
        this.weight = Objects.requireNonNull(weight, "Weight must be defined.");
        this.origin = Objects.requireNonNull(origin, "Origin must be defined.");
        this.dispatchFeePayment = Objects.requireNonNull(dispatchFeePayment, "Dispatch fee payment must be defined.");
        this.call = Objects.requireNonNull(call, "Call must be defined.");
    }

    // Runtime spec version of the target chain the call was encoded for
    public int getSpecVersion() {
        return specVersion;
    }

    // Weight the sender paid for
    public Weight getWeight() {
        return weight;
    }

    public CallOrigin getOrigin() {
        return origin;
    }

    public DispatchFeePayment getDispatchFeePayment() {
        return dispatchFeePayment;
    }

    public byte[] getCall() {
        return Arrays.copyOf(call, call.length);
    }

    @Override
    public MessagePayloadSerializer serializer() {
        return MessagePayloadSerializer.getSerializer();
    }

    @Override
    public byte[] bytes() {
        return serializer().toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessagePayload)) return false;
        MessagePayload that = (MessagePayload) o;
        return specVersion == that.specVersion
                && weight.equals(that.weight)
                && origin.equals(that.origin)
                && dispatchFeePayment == that.dispatchFeePayment
                && Arrays.equals(call, that.call);
    }

    @Override
    public int hashCode() {
        return Objects.hash(specVersion, weight, origin, dispatchFeePayment) * 31 + Arrays.hashCode(call);
    }

    @Override
    public String toString() {
        return "MessagePayload{specVersion=" + specVersion + ", weight=" + weight + ", origin=" + origin
                + ", dispatchFeePayment=" + dispatchFeePayment + ", callSize=" + call.length + "}";
    }
}
