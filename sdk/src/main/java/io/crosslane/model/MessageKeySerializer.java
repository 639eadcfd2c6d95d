package io.crosslane.model;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;

public final class MessageKeySerializer implements BytesSerializer<MessageKey> {
    private static final MessageKeySerializer serializer = new MessageKeySerializer();

    private MessageKeySerializer() {
        super();
    }

    public static MessageKeySerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(MessageKey key, BytesWriter writer) {
        writer.putBytes(key.getLaneId().toBytes());
        writer.putLong(key.getNonce());
    }

    @Override
    public MessageKey parse(BytesReader reader) {
        LaneId laneId = new LaneId(reader.getBytes(LaneId.LENGTH));
        return new MessageKey(laneId, reader.getLong());
    }
}
