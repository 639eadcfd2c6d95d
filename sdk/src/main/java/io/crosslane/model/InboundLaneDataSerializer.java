package io.crosslane.model;

import io.crosslane.codec.BytesReader;
import io.crosslane.codec.BytesSerializer;
import io.crosslane.codec.BytesWriter;

import java.util.ArrayList;
import java.util.List;

public final class InboundLaneDataSerializer implements BytesSerializer<InboundLaneData> {
    private static final InboundLaneDataSerializer serializer = new InboundLaneDataSerializer();

    // A relayer entry takes 48 bytes, this bounds the allocation for corrupted input
    private static final int MAX_RELAYER_ENTRIES = 65536;

    private InboundLaneDataSerializer() {
        super();
    }

    public static InboundLaneDataSerializer getSerializer() {
        return serializer;
    }

    @Override
    public void serialize(InboundLaneData data, BytesWriter writer) {
        writer.putInt(data.getRelayers().size());
        for (UnrewardedRelayer entry : data.getRelayers()) {
            writer.putBytes(entry.getRelayer().toBytes());
            writer.putLong(entry.getMessages().getBegin());
            writer.putLong(entry.getMessages().getEnd());
        }
        writer.putLong(data.getLastConfirmedNonce());
    }

    @Override
    public InboundLaneData parse(BytesReader reader) {
        int size = reader.getInt();
        if (size < 0 || size > MAX_RELAYER_ENTRIES)
            throw new IllegalArgumentException(String.format("Input data corrupted: `%d` relayer entries", size));
        List<UnrewardedRelayer> relayers = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            AccountId relayer = new AccountId(reader.getBytes(AccountId.LENGTH));
            relayers.add(new UnrewardedRelayer(relayer, new DeliveredMessages(reader.getLong(), reader.getLong())));
        }
        return new InboundLaneData(relayers, reader.getLong());
    }
}
