package io.crosslane.fixtures;

import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.proof.BridgedHeader;
import io.crosslane.proof.MessagesDeliveryProof;
import io.crosslane.proof.MessagesProof;
import io.crosslane.proof.StorageKeys;
import io.crosslane.trie.MemoryTrie;
import io.crosslane.utils.ByteArrayWrapper;
import io.crosslane.utils.Hash;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage of a bridged chain. Every finalized header commits to the storage as it was at that moment, proofs
 * are generated against the trie of the header they reference.
 */
public class BridgedChainFixture {
    private final String namespace;
    private final Map<ByteArrayWrapper, byte[]> storage = new HashMap<>();
    private final Map<Hash, MemoryTrie> tries = new HashMap<>();
    private final TestFinalityProvider finalityProvider = new TestFinalityProvider();
    private Hash bestHash = Hash.ZERO;
    private long bestNumber = 0;

    public BridgedChainFixture(String namespace) {
        this.namespace = namespace;
    }

    public String getNamespace() {
        return namespace;
    }

    public TestFinalityProvider getFinalityProvider() {
        return finalityProvider;
    }

    public BridgedChainFixture putMessage(LaneId laneId, long nonce, MessageData message) {
        return putRaw(StorageKeys.messageKey(namespace, new MessageKey(laneId, nonce)), message.bytes());
    }

    public BridgedChainFixture putOutboundLaneData(LaneId laneId, OutboundLaneData data) {
        return putRaw(StorageKeys.outboundLaneDataKey(namespace, laneId), data.bytes());
    }

    public BridgedChainFixture putInboundLaneData(LaneId laneId, InboundLaneData data) {
        return putRaw(StorageKeys.inboundLaneDataKey(namespace, laneId), data.bytes());
    }

    public BridgedChainFixture putRaw(byte[] key, byte[] value) {
        storage.put(new ByteArrayWrapper(key), value);
        return this;
    }

    // Builds a header over the current storage, finalized unless told otherwise
    public BridgedHeader produceHeader(boolean finalized) {
        MemoryTrie trie = new MemoryTrie(new HashMap<>(storage));
        BridgedHeader header = new BridgedHeader(bestHash, bestNumber + 1, trie.rootHash(), Hash.ZERO);
        tries.put(header.hash(), trie);
        bestHash = header.hash();
        bestNumber = header.getNumber();
        if (finalized)
            finalityProvider.finalize(header);
        return header;
    }

    public BridgedHeader finalizeHeader() {
        return produceHeader(true);
    }

    public MessagesProof messagesProof(BridgedHeader header, LaneId laneId, long start, long end, boolean withLaneState) {
        List<byte[]> keys = new ArrayList<>();
        for (long nonce = start; nonce <= end; nonce++) {
            keys.add(StorageKeys.messageKey(namespace, new MessageKey(laneId, nonce)));
        }
        if (withLaneState)
            keys.add(StorageKeys.outboundLaneDataKey(namespace, laneId));
        return new MessagesProof(header.hash(), tries.get(header.hash()).generateProof(keys), laneId, start, end);
    }

    public MessagesDeliveryProof deliveryProof(BridgedHeader header, LaneId laneId) {
        List<byte[]> keys = List.of(StorageKeys.inboundLaneDataKey(namespace, laneId));
        return new MessagesDeliveryProof(header.hash(), tries.get(header.hash()).generateProof(keys), laneId);
    }
}
