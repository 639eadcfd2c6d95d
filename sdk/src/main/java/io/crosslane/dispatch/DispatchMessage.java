package io.crosslane.dispatch;

import io.crosslane.model.Message;
import io.crosslane.model.MessageKey;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Message proven to be sent by the bridged chain, handed over to dispatch. The payload is still undecoded.
 */
public final class DispatchMessage {
    private final MessageKey key;
    private final BigInteger fee;
    private final byte[] payload;

    public DispatchMessage(MessageKey key, BigInteger fee, byte[] payload) {
        this.key = key;
        this.fee = fee;
        this.payload = payload;
    }

    public static DispatchMessage from(Message message) {
        return new DispatchMessage(message.getKey(), message.getData().getFee(), message.getData().getPayload());
    }

    public MessageKey getKey() {
        return key;
    }

    public BigInteger getFee() {
        return fee;
    }

    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }
}
