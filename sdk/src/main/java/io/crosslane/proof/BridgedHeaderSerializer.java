package io.crosslane.proof;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;
import io.crosslane.utils.Hash;

/**
 * Also decodes parachain heads of chains that use this header format.
 */
public final class BridgedHeaderSerializer implements BytesSerializer<BridgedHeader>, ParachainHeadDecoder {
    private static final BridgedHeaderSerializer serializer = new BridgedHeaderSerializer();

    private BridgedHeaderSerializer() {
        super();
    }

    public static BridgedHeaderSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(BridgedHeader header, BytesWriter writer) {
        writer.putBytes(header.getParentHash().toBytes());
        writer.putLong(header.getNumber());
        writer.putBytes(header.getStateRoot().toBytes());
        writer.putBytes(header.getExtrinsicsRoot().toBytes());
    }

    @Override
    public BridgedHeader parse(BytesReader reader) {
        Hash parentHash = new Hash(reader.getBytes(Hash.LENGTH));
        long number = reader.getLong();
        Hash stateRoot = new Hash(reader.getBytes(Hash.LENGTH));
        return new BridgedHeader(parentHash, number, stateRoot, new Hash(reader.getBytes(Hash.LENGTH)));
    }

    @Override
    public Hash stateRoot(byte[] encodedHead) {
        return parseBytes(encodedHead).getStateRoot();
    }
}
