package io.crosslane.model;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;

public final class OutboundLaneDataSerializer implements BytesSerializer<OutboundLaneData> {
    private static final OutboundLaneDataSerializer serializer = new OutboundLaneDataSerializer();

    private OutboundLaneDataSerializer() {
        super();
    }

    public static OutboundLaneDataSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(OutboundLaneData data, BytesWriter writer) {
        writer.putLong(data.getOldestUnprunedNonce());
        writer.putLong(data.getLatestReceivedNonce());
        writer.putLong(data.getLatestGeneratedNonce());
    }

    @Override
    public OutboundLaneData parse(BytesReader reader) {
        return new OutboundLaneData(reader.getLong(), reader.getLong(), reader.getLong());
    }
}
