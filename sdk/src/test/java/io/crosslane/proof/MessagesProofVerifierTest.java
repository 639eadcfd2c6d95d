package io.crosslane.proof;

import io.crosslane.errors.BridgeError;
import io.crosslane.fixtures.BridgedChainFixture;
import io.crosslane.model.AccountId;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.UnrewardedRelayer;
import io.crosslane.utils.Hash;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class MessagesProofVerifierTest {
    private static final String NAMESPACE = "BridgeMessages";
    private static final LaneId LANE = LaneId.fromName("roli");
    private static final AccountId RELAYER = new AccountId("0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e0e");

    private BridgedChainFixture bridgedChain;
    private MessagesProofVerifier verifier;

    @Before
    public void setUp() {
        bridgedChain = new BridgedChainFixture(NAMESPACE);
        for (long nonce = 1; nonce <= 3; nonce++) {
            bridgedChain.putMessage(LANE, nonce, new MessageData(BigInteger.valueOf(nonce * 10), new byte[]{(byte) nonce}));
        }
        bridgedChain.putOutboundLaneData(LANE, new OutboundLaneData(1, 0, 3));
        verifier = new MessagesProofVerifier(new DirectFinalityAnchor(bridgedChain.getFinalityProvider()), NAMESPACE);
    }

    private static BridgeError errorOf(ProofCheck check) {
        MessageProofException exception = assertThrows(MessageProofException.class, check::run);
        return exception.getError();
    }

    private interface ProofCheck {
        void run() throws Exception;
    }

    @Test
    public void whenProofIsValid_messagesAndLaneStateAreReturned() throws Exception {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, true);

        // Act
        Map<LaneId, ProvedLaneMessages> proved = verifier.verifyMessagesProof(proof, 3);

        // Assert
        ProvedLaneMessages lane = proved.get(LANE);
        assertEquals(1, proved.size());
        assertEquals(Optional.of(new OutboundLaneData(1, 0, 3)), lane.getLaneState());
        assertEquals(3, lane.getMessages().size());
        assertEquals(new MessageKey(LANE, 2), lane.getMessages().get(1).getKey());
        assertEquals(BigInteger.valueOf(20), lane.getMessages().get(1).getData().getFee());
    }

    @Test
    public void whenClaimedCountDiffersFromRange_proofIsRejected() throws Exception {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, false);

        // Act & Assert
        assertEquals(BridgeError.PROOF_COUNT_MISMATCH, errorOf(() -> verifier.verifyMessagesProof(proof, 2)));
        assertEquals(BridgeError.PROOF_COUNT_MISMATCH, errorOf(() -> verifier.verifyMessagesProof(proof, 4)));
        assertEquals(3, verifier.verifyMessagesProof(proof, 3).get(LANE).getMessages().size());
    }

    @Test
    public void whenRangeIsReversed_negativeCountIsRejected() {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, false);
        MessagesProof reversed = new MessagesProof(header.hash(), proof.getStorageProof(), LANE, 5, 3);

        // Act & Assert
        assertEquals(BridgeError.PROOF_COUNT_MISMATCH, errorOf(() -> verifier.verifyMessagesProof(reversed, -1)));
    }

    @Test
    public void whenRangeIsHuge_verificationStopsAtFirstMissingMessage() {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, false);
        MessagesProof huge = new MessagesProof(header.hash(), proof.getStorageProof(), LANE, 1, Integer.MAX_VALUE);

        // Act
        MessageProofException exception = assertThrows(MessageProofException.class,
                () -> verifier.verifyMessagesProof(huge, Integer.MAX_VALUE));

        // Assert
        assertEquals(BridgeError.PROOF_MISSING_MESSAGE, exception.getError());
        assertTrue(exception.getMessage().contains(new MessageKey(LANE, 4).toString()));
    }

    @Test
    public void whenHeaderIsNotFinalized_proofIsRejected() {
        // Arrange
        BridgedHeader header = bridgedChain.produceHeader(false);
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, true);

        // Act & Assert
        assertEquals(BridgeError.UNKNOWN_HEADER, errorOf(() -> verifier.verifyMessagesProof(proof, 3)));
    }

    @Test
    public void whenMessageIsNotInStorage_proofIsRejected() {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 2, 4, false);

        // Act & Assert
        assertEquals(BridgeError.PROOF_MISSING_MESSAGE, errorOf(() -> verifier.verifyMessagesProof(proof, 3)));
    }

    @Test
    public void whenProofNodesBelongToAnotherState_proofIsRejected() {
        // Arrange
        BridgedHeader oldHeader = bridgedChain.finalizeHeader();
        MessagesProof oldProof = bridgedChain.messagesProof(oldHeader, LANE, 1, 3, true);
        bridgedChain.putMessage(LANE, 4, new MessageData(BigInteger.ONE, new byte[]{4}));
        BridgedHeader newHeader = bridgedChain.finalizeHeader();
        MessagesProof forged = new MessagesProof(newHeader.hash(), oldProof.getStorageProof(), LANE, 1, 3);

        // Act & Assert
        assertEquals(BridgeError.PROOF_ROOT_MISMATCH, errorOf(() -> verifier.verifyMessagesProof(forged, 3)));
    }

    @Test
    public void whenMessageCanNotBeDecoded_proofIsRejected() {
        // Arrange
        bridgedChain.putRaw(StorageKeys.messageKey(NAMESPACE, new MessageKey(LANE, 2)), new byte[]{1, 2});
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, false);

        // Act & Assert
        assertEquals(BridgeError.PROOF_DECODE_FAILURE, errorOf(() -> verifier.verifyMessagesProof(proof, 3)));
    }

    @Test
    public void whenProofHasNeitherMessagesNorLaneState_proofIsEmpty() {
        // Arrange
        LaneId otherLane = LaneId.fromName("pars");
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, otherLane, 1, 0, true);

        // Act & Assert
        assertEquals(BridgeError.PROOF_EMPTY, errorOf(() -> verifier.verifyMessagesProof(proof, 0)));
    }

    @Test
    public void whenProofCarriesOnlyLaneState_itIsAccepted() throws Exception {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 4, 3, true);

        // Act
        ProvedLaneMessages lane = verifier.verifyMessagesProof(proof, 0).get(LANE);

        // Assert
        assertTrue(lane.getMessages().isEmpty());
        assertEquals(3, lane.getLaneState().orElseThrow().getLatestGeneratedNonce());
    }

    @Test
    public void whenDeliveryProofIsValid_inboundLaneStateIsReturned() throws Exception {
        // Arrange
        InboundLaneData inbound = new InboundLaneData(List.of(new UnrewardedRelayer(RELAYER, new DeliveredMessages(1, 2))), 2);
        bridgedChain.putInboundLaneData(LANE, inbound);
        BridgedHeader header = bridgedChain.finalizeHeader();

        // Act
        ParsedDeliveryProof parsed = verifier.verifyMessagesDeliveryProof(bridgedChain.deliveryProof(header, LANE));

        // Assert
        assertEquals(LANE, parsed.getLaneId());
        assertEquals(inbound, parsed.getInboundLaneData());
    }

    @Test
    public void whenInboundLaneStateIsMissing_deliveryProofIsRejected() {
        // Arrange
        BridgedHeader header = bridgedChain.finalizeHeader();
        MessagesDeliveryProof proof = bridgedChain.deliveryProof(header, LANE);

        // Act & Assert
        assertEquals(BridgeError.PROOF_MISSING_MESSAGE, errorOf(() -> verifier.verifyMessagesDeliveryProof(proof)));
    }

    @Test
    public void whenBridgedChainIsParachain_stateRootComesFromItsFinalizedHead() throws Exception {
        // Arrange
        ParaId paraId = new ParaId(2000);
        BridgedHeader header = bridgedChain.produceHeader(false);
        ParachainHeadsProvider heads = mock(ParachainHeadsProvider.class);
        when(heads.getFinalizedParachainHead(any(), any())).thenReturn(Optional.empty());
        when(heads.getFinalizedParachainHead(paraId, header.hash())).thenReturn(Optional.of(header.bytes()));
        MessagesProofVerifier parachainVerifier = new MessagesProofVerifier(
                new ParachainFinalityAnchor(heads, paraId, BridgedHeaderSerializer.getSerializer()), NAMESPACE);
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, true);
        MessagesProof unknownHead = new MessagesProof(Hash.ZERO, proof.getStorageProof(), LANE, 1, 3);

        // Act
        ProvedLaneMessages lane = parachainVerifier.verifyMessagesProof(proof, 3).get(LANE);

        // Assert
        assertEquals(3, lane.getMessages().size());
        assertEquals(BridgeError.UNKNOWN_HEADER, errorOf(() -> parachainVerifier.verifyMessagesProof(unknownHead, 3)));
    }

    @Test
    public void whenParachainHeadCanNotBeDecoded_proofIsRejected() {
        // Arrange
        ParaId paraId = new ParaId(2000);
        BridgedHeader header = bridgedChain.produceHeader(false);
        ParachainHeadsProvider heads = mock(ParachainHeadsProvider.class);
        when(heads.getFinalizedParachainHead(paraId, header.hash())).thenReturn(Optional.of(new byte[]{7, 7, 7}));
        MessagesProofVerifier parachainVerifier = new MessagesProofVerifier(
                new ParachainFinalityAnchor(heads, paraId, BridgedHeaderSerializer.getSerializer()), NAMESPACE);
        MessagesProof proof = bridgedChain.messagesProof(header, LANE, 1, 3, true);

        // Act & Assert
        assertEquals(BridgeError.PROOF_DECODE_FAILURE, errorOf(() -> parachainVerifier.verifyMessagesProof(proof, 3)));
    }
}
