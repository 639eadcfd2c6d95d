package io.crosslane.proof;

import io.crosslane.errors.BridgeError;
import io.crosslane.model.InboundLaneData;
import io.crosslane.model.InboundLaneDataSerializer;
import io.crosslane.model.LaneId;
import io.crosslane.model.Message;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageDataSerializer;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.OutboundLaneDataSerializer;
import io.crosslane.trie.StorageProofChecker;
import io.crosslane.trie.StorageProofException;
import io.crosslane.utils.Converter;
import io.crosslane.utils.Hash;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies storage proofs of the bridged chain bridge records against a finalized state root.
 * <p>
 * Verification is all-or-nothing: either every message of the claimed range is returned, or an exception
 * is thrown and nothing of the proof may be used.
 */
public class MessagesProofVerifier {
    private static final Logger logger = LogManager.getLogger();

    static final String COUNT_MISMATCH = "Proof covers nonces %d..=%d, but %d messages are claimed";
    static final String ROOT_MISMATCH = "Storage proof does not match the state root of header `%s`";
    static final String MISSING_MESSAGE = "Message %s is missing from the proof";
    static final String UNDECODABLE_MESSAGE = "Message %s can not be decoded";
    static final String UNDECODABLE_LANE_STATE = "Outbound lane state of lane %s can not be decoded";
    static final String EMPTY_PROOF = "Proof contains neither messages nor lane state";
    static final String MISSING_INBOUND_LANE = "Inbound lane state of lane %s is missing from the proof";
    static final String UNDECODABLE_INBOUND_LANE = "Inbound lane state of lane %s can not be decoded";

    private final StateRootAnchor anchor;
    private final String bridgedNamespace;

    /**
     * @param bridgedNamespace name under which the bridged chain keeps its bridge records
     */
    public MessagesProofVerifier(StateRootAnchor anchor, String bridgedNamespace) {
        this.anchor = anchor;
        this.bridgedNamespace = bridgedNamespace;
    }

    public Map<LaneId, ProvedLaneMessages> verifyMessagesProof(MessagesProof proof, int messagesCount) throws MessageProofException {
        long start = proof.getNoncesStart();
        long end = proof.getNoncesEnd();
        if (messagesCount < 0 || end - start + 1 != messagesCount)
            throw new MessageProofException(BridgeError.PROOF_COUNT_MISMATCH, String.format(COUNT_MISMATCH, start, end, messagesCount));

        StorageProofChecker checker = checker(proof.getBridgedHeaderHash(), proof.getStorageProof());
        LaneId laneId = proof.getLaneId();

        List<Message> messages = new ArrayList<>();
        for (long nonce = start; nonce <= end; nonce++) {
            MessageKey key = new MessageKey(laneId, nonce);
            byte[] raw = read(checker, StorageKeys.messageKey(bridgedNamespace, key))
                    .orElseThrow(() -> new MessageProofException(BridgeError.PROOF_MISSING_MESSAGE, String.format(MISSING_MESSAGE, key)));
            MessageData data;
            try {
                data = MessageDataSerializer.getSerializer().parseBytes(raw);
            } catch (IllegalArgumentException e) {
                throw new MessageProofException(BridgeError.PROOF_DECODE_FAILURE, String.format(UNDECODABLE_MESSAGE, key), e);
            }
            messages.add(new Message(key, data));
        }

        Optional<OutboundLaneData> laneState = Optional.empty();
        Optional<byte[]> rawLaneState = read(checker, StorageKeys.outboundLaneDataKey(bridgedNamespace, laneId));
        if (rawLaneState.isPresent()) {
            try {
                laneState = Optional.of(OutboundLaneDataSerializer.getSerializer().parseBytes(rawLaneState.get()));
            } catch (IllegalArgumentException e) {
                throw new MessageProofException(BridgeError.PROOF_DECODE_FAILURE, String.format(UNDECODABLE_LANE_STATE, laneId), e);
            }
        }

        if (laneState.isEmpty() && messages.isEmpty())
            throw new MessageProofException(BridgeError.PROOF_EMPTY, EMPTY_PROOF);

        logger.debug("Verified proof of {} messages and {} lane state at lane {}",
                messages.size(), laneState.isPresent() ? "a" : "no", laneId);
        return Map.of(laneId, new ProvedLaneMessages(laneState, messages));
    }

    public ParsedDeliveryProof verifyMessagesDeliveryProof(MessagesDeliveryProof proof) throws MessageProofException {
        LaneId laneId = proof.getLaneId();
        StorageProofChecker checker = checker(proof.getBridgedHeaderHash(), proof.getStorageProof());
        byte[] raw = read(checker, StorageKeys.inboundLaneDataKey(bridgedNamespace, laneId))
                .orElseThrow(() -> new MessageProofException(BridgeError.PROOF_MISSING_MESSAGE, String.format(MISSING_INBOUND_LANE, laneId)));
        try {
            InboundLaneData data = InboundLaneDataSerializer.getSerializer().parseBytes(raw);
            return new ParsedDeliveryProof(laneId, data);
        } catch (IllegalArgumentException e) {
            throw new MessageProofException(BridgeError.PROOF_DECODE_FAILURE, String.format(UNDECODABLE_INBOUND_LANE, laneId), e);
        }
    }

    private StorageProofChecker checker(Hash headerHash, List<byte[]> storageProof) throws MessageProofException {
        Hash stateRoot = anchor.stateRoot(headerHash);
        try {
            return new StorageProofChecker(stateRoot, storageProof);
        } catch (StorageProofException e) {
            throw new MessageProofException(BridgeError.PROOF_ROOT_MISMATCH, String.format(ROOT_MISMATCH, headerHash), e);
        }
    }

    // A key whose trie path is not fully covered by the proof reads as absent
    private static Optional<byte[]> read(StorageProofChecker checker, byte[] key) {
        try {
            return checker.readValue(key);
        } catch (StorageProofException e) {
            logger.debug("Storage proof does not cover key {}: {}", Converter.toHexString(key), e.getMessage());
            return Optional.empty();
        }
    }
}
