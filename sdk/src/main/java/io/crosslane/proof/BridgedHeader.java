package io.crosslane.proof;

import io.crosslane.codec.BytesSerializable;
import io.crosslane.utils.Hash;

/**
 * Header of the bridged chain, as far as the bridge needs it.
 */
public final class BridgedHeader implements BytesSerializable {
    private final Hash parentHash;
    private final long number;
    private final Hash stateRoot;
    private final Hash extrinsicsRoot;

    public BridgedHeader(Hash parentHash, long number, Hash stateRoot, Hash extrinsicsRoot) {
        this.parentHash = parentHash;
        this.number = number;
        this.stateRoot = stateRoot;
        this.extrinsicsRoot = extrinsicsRoot;
    }

    public Hash getParentHash() {
        return parentHash;
    }

    public long getNumber() {
        return number;
    }

    public Hash getStateRoot() {
        return stateRoot;
    }

    public Hash getExtrinsicsRoot() {
        return extrinsicsRoot;
    }

    public Hash hash() {
        return Hash.of(bytes());
    }

    @Override
    public BridgedHeaderSerializer serializer() {
        return BridgedHeaderSerializer.getSerializer();
    }

    @Override
    public byte[] bytes() {
        return serializer().toBytes(this);
    }

    @Override
    public String toString() {
        return "BridgedHeader{number=" + number + ", parentHash=" + parentHash + ", stateRoot=" + stateRoot + "}";
    }
}
