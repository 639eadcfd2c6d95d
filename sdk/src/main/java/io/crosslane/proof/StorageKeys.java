package io.crosslane.proof;

import io.crosslane.model.LaneId;
import io.crosslane.model.MessageKey;
import io.crosslane.model.MessageKeySerializer;
import io.crosslane.utils.Blake2b;
import io.crosslane.utils.BytesUtils;

import java.nio.charset.StandardCharsets;

/**
 * Keys of the bridge records in the chain state trie.
 * A key is `blake2b128(namespace) | blake2b128(map) | blake2b128(key) | key`.
 */
public final class StorageKeys {
    public static final String OUTBOUND_MESSAGES = "OutboundMessages";
    public static final String OUTBOUND_LANES = "OutboundLanes";
    public static final String INBOUND_LANES = "InboundLanes";

    private StorageKeys() {}

    public static byte[] messageKey(String namespace, MessageKey key) {
        return mapKey(namespace, OUTBOUND_MESSAGES, MessageKeySerializer.getSerializer().toBytes(key));
    }

    public static byte[] outboundLaneDataKey(String namespace, LaneId laneId) {
        return mapKey(namespace, OUTBOUND_LANES, laneId.toBytes());
    }

    public static byte[] inboundLaneDataKey(String namespace, LaneId laneId) {
        return mapKey(namespace, INBOUND_LANES, laneId.toBytes());
    }

    static byte[] mapKey(String namespace, String map, byte[] key) {
        return BytesUtils.concat(
                Blake2b.hash128(namespace.getBytes(StandardCharsets.UTF_8)),
                Blake2b.hash128(map.getBytes(StandardCharsets.UTF_8)),
                Blake2b.hash128(key),
                key);
    }
}
