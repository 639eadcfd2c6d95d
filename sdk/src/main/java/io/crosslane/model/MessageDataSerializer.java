package io.crosslane.model;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;

public final class MessageDataSerializer implements BytesSerializer<MessageData> {
    private static final MessageDataSerializer serializer = new MessageDataSerializer();

    private MessageDataSerializer() {
        super();
    }

    public static MessageDataSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(MessageData data, BytesWriter writer) {
        writer.putBalance(data.getFee());
        writer.putVarBytes(data.getPayload());
    }

    @Override
    public MessageData parse(BytesReader reader) {
        return new MessageData(reader.getBalance(), reader.getVarBytes());
    }
}
