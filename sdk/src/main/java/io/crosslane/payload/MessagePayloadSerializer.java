package io.crosslane.payload;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;
import io.crosslane.model.Weight;

public final class MessagePayloadSerializer implements BytesSerializer<MessagePayload> {
    private static final MessagePayloadSerializer serializer = new MessagePayloadSerializer();

    private MessagePayloadSerializer() {
        super();
    }

    public static MessagePayloadSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(MessagePayload payload, BytesWriter writer) {
        writer.putInt(payload.getSpecVersion());
        writer.putLong(payload.getWeight().value());
        CallOriginSerializer.getSerializer().serialize(payload.getOrigin(), writer);
        writer.putByte(payload.getDispatchFeePayment().code());
        writer.putVarBytes(payload.getCall());
    }

    @Override
    public MessagePayload parse(BytesReader reader) {
        int specVersion = reader.getInt();
        Weight weight = Weight.of(reader.getLong());
        CallOrigin origin = CallOriginSerializer.getSerializer().parse(reader);
        DispatchFeePayment feePayment = DispatchFeePayment.fromCode(reader.getByte());
        return new MessagePayload(specVersion, weight, origin, feePayment, reader.getVarBytes());
    }
}
