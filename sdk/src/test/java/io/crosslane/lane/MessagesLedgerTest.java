package io.crosslane.lane;

import io.crosslane.dispatch.CallDispatcher;
import io.crosslane.dispatch.CallMessageDispatch;
import io.crosslane.dispatch.CallValidator;
import io.crosslane.dispatch.DispatchFeePayer;
import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;
import io.crosslane.events.BridgeEventLog;
import io.crosslane.events.LaneAdvanceRecord;
import io.crosslane.events.MessageAcceptedEvent;
import io.crosslane.events.MessagesDeliveredEvent;
import io.crosslane.fee.FeeMarket;
import io.crosslane.fee.FeeMarketPayment;
import io.crosslane.fee.InMemoryCurrency;
import io.crosslane.fee.LinearSlasher;
import io.crosslane.fee.RelayersRegistry;
import io.crosslane.fixtures.BridgedChainFixture;
import io.crosslane.fixtures.TestSettings;
import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.UnrewardedRelayer;
import io.crosslane.model.Weight;
import io.crosslane.payload.DispatchFeePayment;
import io.crosslane.payload.MessagePayload;
import io.crosslane.payload.RawOrigin;
import io.crosslane.payload.SourceAccountOrigin;
import io.crosslane.payload.SourceRootOrigin;
import io.crosslane.proof.BridgedHeader;
import io.crosslane.proof.DirectFinalityAnchor;
import io.crosslane.proof.MessagesProof;
import io.crosslane.proof.MessagesProofVerifier;
import io.crosslane.settings.FeeMarketSettings;
import io.crosslane.storage.InMemoryKeyValueStore;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class MessagesLedgerTest {
    private static final String NAMESPACE = "BridgeMessages";
    private static final ChainId THIS_CHAIN = ChainId.fromName("pngl");
    private static final ChainId BRIDGED_CHAIN = ChainId.fromName("pnll");
    private static final LaneId LANE = LaneId.fromName("roli");
    private static final int SPEC_VERSION = 1;
    private static final AccountId A = new AccountId("0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a");
    private static final AccountId B = new AccountId("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");
    private static final AccountId C = new AccountId("0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c");
    private static final AccountId SUBMITTER = new AccountId("5555555555555555555555555555555555555555555555555555555555555555");
    private static final AccountId MESSAGE_RELAYER = new AccountId("6666666666666666666666666666666666666666666666666666666666666666");
    private static final AccountId CONFIRM_RELAYER = new AccountId("8888888888888888888888888888888888888888888888888888888888888888");
    private static final BigInteger FEE = BigInteger.valueOf(100);

    private AtomicLong block;
    private InMemoryCurrency currency;
    private FeeMarket feeMarket;
    private BridgeEventLog events;
    private CallDispatcher<String> callDispatcher;
    private BridgedChainFixture bridgedChain;
    private MessagesLedger ledger;

    @Before
    @SuppressWarnings("unchecked")
    public void setUp() throws Exception {
        FeeMarketSettings feeSettings = TestSettings.feeMarket();
        block = new AtomicLong(100);
        events = new BridgeEventLog();

        currency = new InMemoryCurrency();
        currency.deposit(SUBMITTER, BigInteger.valueOf(1000));
        RelayersRegistry registry = new RelayersRegistry(new InMemoryKeyValueStore<>(), currency, feeSettings);
        long relayerFee = 10;
        for (AccountId relayer : List.of(A, B, C)) {
            currency.deposit(relayer, BigInteger.valueOf(1000));
            registry.enroll(relayer, BigInteger.valueOf(200), BigInteger.valueOf(relayerFee));
            relayerFee += 10;
        }
        feeMarket = new FeeMarket(new InMemoryKeyValueStore<>(), registry, feeSettings);
        FeeMarketPayment payment = new FeeMarketPayment(currency, feeMarket, new LinearSlasher(feeSettings.getSlashPerBlock()),
                feeSettings, events);

        callDispatcher = mock(CallDispatcher.class);
        when(callDispatcher.decode(any())).thenReturn("remark");
        when(callDispatcher.minimalWeight("remark")).thenReturn(Weight.of(10));
        when(callDispatcher.execute(any(), eq("remark"))).thenReturn(Optional.of(Weight.of(10)));
        CallMessageDispatch<String> dispatch = new CallMessageDispatch<>(BRIDGED_CHAIN, THIS_CHAIN, SPEC_VERSION,
                callDispatcher, mock(CallValidator.class), mock(DispatchFeePayer.class), events);

        bridgedChain = new BridgedChainFixture(NAMESPACE);
        MessagesProofVerifier proofVerifier = new MessagesProofVerifier(
                new DirectFinalityAnchor(bridgedChain.getFinalityProvider()), NAMESPACE);

        ledger = new MessagesLedger(TestSettings.lanes(),
                new ChainMessageVerifier(new ConfiguredBridgedChain(1024, Weight.of(1000))),
                new LaneMessageVerifier(new ConfiguredThisChain(List.of(LANE), 16), feeMarket),
                proofVerifier, dispatch, feeMarket, payment, LaneStores.inMemory(), events, block::get);
    }

    private static MessagePayload payload(byte[] call) {
        return new MessagePayload(SPEC_VERSION, Weight.of(100), new SourceAccountOrigin(SUBMITTER),
                DispatchFeePayment.AT_SOURCE_CHAIN, call);
    }

    private static MessagePayload payload() {
        return payload("remark".getBytes(StandardCharsets.UTF_8));
    }

    private long send() throws BridgeException {
        return ledger.sendMessage(RawOrigin.signed(SUBMITTER), LANE, payload(), FEE);
    }

    // Messages the bridged chain has sent to us, with its outbound lane state
    private MessagesProof incomingProof(long count) {
        MessagePayload incoming = new MessagePayload(SPEC_VERSION, Weight.of(100), SourceRootOrigin.INSTANCE,
                DispatchFeePayment.AT_SOURCE_CHAIN, "remark".getBytes(StandardCharsets.UTF_8));
        for (long nonce = 1; nonce <= count; nonce++) {
            bridgedChain.putMessage(LANE, nonce, new MessageData(FEE, incoming.bytes()));
        }
        bridgedChain.putOutboundLaneData(LANE, new OutboundLaneData(1, 0, count));
        BridgedHeader header = bridgedChain.finalizeHeader();
        return bridgedChain.messagesProof(header, LANE, 1, count, true);
    }

    @Test
    public void whenMessageIsSent_feeIsLockedAndOrderIsCreated() throws Exception {
        // Act
        long nonce = send();

        // Assert
        assertEquals(1, nonce);
        assertEquals(new OutboundLaneData(1, 0, 1), ledger.outboundLaneData(LANE));
        assertEquals(FEE, currency.freeBalance(TestSettings.RELAYER_FUND));
        assertEquals(BigInteger.valueOf(900), currency.freeBalance(SUBMITTER));
        assertTrue(feeMarket.getOrder(new MessageKey(LANE, 1)).isPresent());
        assertEquals(Optional.of(new MessageData(FEE, payload().bytes())), ledger.outboundMessage(LANE, 1));
        MessageAcceptedEvent event = events.eventsOfType(MessageAcceptedEvent.class).get(0);
        assertEquals(new MessageKey(LANE, 1), event.getKey());
        assertEquals(FEE, event.getFee());
    }

    @Test
    public void whenFeeIsBelowMarketFee_nothingIsChanged() {
        // Act
        BridgeException exception = assertThrows(BridgeException.class,
                () -> ledger.sendMessage(RawOrigin.signed(SUBMITTER), LANE, payload(), BigInteger.valueOf(29)));

        // Assert
        assertEquals(BridgeError.TOO_LOW_FEE, exception.getError());
        assertEquals(OutboundLaneData.DEFAULT, ledger.outboundLaneData(LANE));
        assertEquals(BigInteger.valueOf(1000), currency.freeBalance(SUBMITTER));
        assertFalse(feeMarket.getOrder(new MessageKey(LANE, 1)).isPresent());
        assertTrue(events.events().isEmpty());
    }

    @Test
    public void whenPayloadDoesNotFitDeliveryTransaction_messageIsRejected() {
        // Arrange
        MessagePayload large = payload(new byte[700]);

        // Act
        BridgeException exception = assertThrows(BridgeException.class,
                () -> ledger.sendMessage(RawOrigin.signed(SUBMITTER), LANE, large, FEE));

        // Assert
        assertEquals(BridgeError.MESSAGE_TOO_LARGE, exception.getError());
        assertEquals(OutboundLaneData.DEFAULT, ledger.outboundLaneData(LANE));
    }

    @Test
    public void whenLaneIsNotConfigured_messageIsRejected() {
        // Act
        BridgeException exception = assertThrows(BridgeException.class,
                () -> ledger.sendMessage(RawOrigin.signed(SUBMITTER), LaneId.fromName("pars"), payload(), FEE));

        // Assert
        assertEquals(BridgeError.MESSAGE_REJECTED_BY_LANE, exception.getError());
    }

    @Test
    public void whenMessagesProofIsReceived_messagesAreDispatchedAndRelayerIsRecorded() throws Exception {
        // Arrange
        MessagesProof proof = incomingProof(2);

        // Act
        InboundBatchOutcome outcome = ledger.receiveMessagesProof(MESSAGE_RELAYER, proof, 2, Weight.of(200));

        // Assert
        assertEquals(0, outcome.getPreviousNonce());
        assertEquals(2, outcome.getLastConfirmedNonce());
        assertEquals(2, outcome.acceptedMessages());
        assertTrue(outcome.getDispatchResults().get(1L).getDispatchResult());
        assertEquals(Weight.of(90), outcome.getDispatchResults().get(2L).getUnspentWeight());
        assertEquals(new InboundLaneData(List.of(new UnrewardedRelayer(MESSAGE_RELAYER, new DeliveredMessages(1, 2))), 2),
                ledger.inboundLaneData(LANE));
        verify(callDispatcher, times(2)).execute(any(), eq("remark"));
        LaneAdvanceRecord record = events.eventsOfType(LaneAdvanceRecord.class).get(0);
        assertEquals(2, record.getLastConfirmedNonce());
        assertEquals(0, record.getSkippedDuplicates());
    }

    @Test
    public void whenDeclaredDispatchWeightIsTooLow_nothingIsDispatched() throws Exception {
        // Arrange
        MessagesProof proof = incomingProof(2);

        // Act
        BridgeException exception = assertThrows(BridgeException.class,
                () -> ledger.receiveMessagesProof(MESSAGE_RELAYER, proof, 2, Weight.of(150)));

        // Assert
        assertEquals(BridgeError.INVALID_DISPATCH_WEIGHT, exception.getError());
        assertEquals(InboundLaneData.DEFAULT, ledger.inboundLaneData(LANE));
        verify(callDispatcher, never()).execute(any(), any());
    }

    @Test
    public void whenSameProofIsSubmittedTwice_messagesAreNotDispatchedAgain() throws Exception {
        // Arrange
        MessagesProof proof = incomingProof(2);
        ledger.receiveMessagesProof(MESSAGE_RELAYER, proof, 2, Weight.of(200));

        // Act
        InboundBatchOutcome outcome = ledger.receiveMessagesProof(CONFIRM_RELAYER, proof, 2, Weight.of(200));

        // Assert
        assertEquals(List.of(1L, 2L), outcome.getDuplicateNonces());
        assertEquals(0, outcome.acceptedMessages());
        assertEquals(2, ledger.inboundLaneData(LANE).getLastConfirmedNonce());
        assertEquals(1, ledger.inboundLaneData(LANE).getRelayers().size());
        verify(callDispatcher, times(2)).execute(any(), eq("remark"));
    }

    @Test
    public void whenClaimedCountDoesNotMatchProof_nothingIsApplied() throws Exception {
        // Arrange
        MessagesProof proof = incomingProof(2);

        // Act
        BridgeException exception = assertThrows(BridgeException.class,
                () -> ledger.receiveMessagesProof(MESSAGE_RELAYER, proof, 3, Weight.of(300)));

        // Assert
        assertEquals(BridgeError.PROOF_COUNT_MISMATCH, exception.getError());
        assertEquals(InboundLaneData.DEFAULT, ledger.inboundLaneData(LANE));
        assertTrue(events.events().isEmpty());
    }

    @Test
    public void whenClaimedCountIsNegative_proofIsRejectedBeforeVerification() throws Exception {
        // Arrange
        MessagesProof proof = incomingProof(2);
        MessagesProof reversed = new MessagesProof(proof.getBridgedHeaderHash(), proof.getStorageProof(), LANE, 5, 3);

        // Act
        BridgeException exception = assertThrows(BridgeException.class,
                () -> ledger.receiveMessagesProof(MESSAGE_RELAYER, reversed, -1, Weight.of(300)));

        // Assert
        assertEquals(BridgeError.PROOF_COUNT_MISMATCH, exception.getError());
        assertEquals(InboundLaneData.DEFAULT, ledger.inboundLaneData(LANE));
        assertTrue(events.events().isEmpty());
    }

    @Test
    public void whenClaimedCountExceedsUnconfirmedLimit_proofIsRejectedBeforeVerification() throws Exception {
        // Arrange
        MessagesProof proof = incomingProof(2);
        MessagesProof huge = new MessagesProof(proof.getBridgedHeaderHash(), proof.getStorageProof(), LANE, 1, Integer.MAX_VALUE);

        // Act
        BridgeException tooMany = assertThrows(BridgeException.class,
                () -> ledger.receiveMessagesProof(MESSAGE_RELAYER, huge, Integer.MAX_VALUE, Weight.of(300)));
        BridgeException overLimit = assertThrows(BridgeException.class,
                () -> ledger.receiveMessagesProof(MESSAGE_RELAYER, proof, 33, Weight.of(300)));

        // Assert
        assertEquals(BridgeError.TOO_MANY_MESSAGES_IN_PROOF, tooMany.getError());
        assertEquals(BridgeError.TOO_MANY_MESSAGES_IN_PROOF, overLimit.getError());
        assertEquals(InboundLaneData.DEFAULT, ledger.inboundLaneData(LANE));
        assertTrue(events.events().isEmpty());
        verify(callDispatcher, never()).execute(any(), any());
    }

    @Test
    public void whenDeliveryIsConfirmed_relayersArePaidAndMessagesArePruned() throws Exception {
        // Arrange
        for (int i = 0; i < 3; i++) {
            send();
        }
        block.set(105);
        bridgedChain.putInboundLaneData(LANE, new InboundLaneData(
                List.of(new UnrewardedRelayer(MESSAGE_RELAYER, new DeliveredMessages(1, 3))), 3));
        BridgedHeader header = bridgedChain.finalizeHeader();

        // Act
        DeliveryConfirmationOutcome outcome = ledger.receiveMessagesDeliveryProof(CONFIRM_RELAYER,
                bridgedChain.deliveryProof(header, LANE));

        // Assert
        assertEquals(Optional.of(new DeliveredMessages(1, 3)), outcome.getConfirmedMessages());
        assertEquals(3, outcome.getPrunedMessages());
        assertEquals(BigInteger.valueOf(300), outcome.getSettlement().get().getTotalFees());
        assertEquals(new OutboundLaneData(4, 3, 3), ledger.outboundLaneData(LANE));
        assertFalse(ledger.outboundMessage(LANE, 1).isPresent());
        assertEquals(BigInteger.valueOf(48), currency.freeBalance(MESSAGE_RELAYER));
        assertEquals(BigInteger.valueOf(12), currency.freeBalance(CONFIRM_RELAYER));
        assertEquals(BigInteger.valueOf(1060), currency.totalBalance(A));
        assertEquals(BigInteger.valueOf(200), currency.lockedBalance(A));
        assertEquals(BigInteger.valueOf(180), currency.freeBalance(TestSettings.TREASURY));
        assertEquals(BigInteger.ZERO, currency.freeBalance(TestSettings.RELAYER_FUND));
        MessagesDeliveredEvent delivered = events.eventsOfType(MessagesDeliveredEvent.class).get(0);
        assertEquals(new DeliveredMessages(1, 3), delivered.getMessages());
    }

    @Test
    public void whenDeliveryProofConfirmsNothingNew_noRewardIsPaid() throws Exception {
        // Arrange
        send();
        bridgedChain.putInboundLaneData(LANE, InboundLaneData.DEFAULT);
        BridgedHeader header = bridgedChain.finalizeHeader();

        // Act
        DeliveryConfirmationOutcome outcome = ledger.receiveMessagesDeliveryProof(CONFIRM_RELAYER,
                bridgedChain.deliveryProof(header, LANE));

        // Assert
        assertFalse(outcome.getConfirmedMessages().isPresent());
        assertFalse(outcome.getSettlement().isPresent());
        assertEquals(0, outcome.getPrunedMessages());
        assertEquals(FEE, currency.freeBalance(TestSettings.RELAYER_FUND));
        assertTrue(events.eventsOfType(MessagesDeliveredEvent.class).isEmpty());
    }

    @Test
    public void whenDeliveryProofConfirmsUnsentMessages_itIsRejected() throws Exception {
        // Arrange
        send();
        bridgedChain.putInboundLaneData(LANE, new InboundLaneData(
                List.of(new UnrewardedRelayer(MESSAGE_RELAYER, new DeliveredMessages(1, 2))), 2));
        BridgedHeader header = bridgedChain.finalizeHeader();

        // Act
        DeliveryConfirmationException exception = assertThrows(DeliveryConfirmationException.class,
                () -> ledger.receiveMessagesDeliveryProof(CONFIRM_RELAYER, bridgedChain.deliveryProof(header, LANE)));

        // Assert
        assertEquals(DeliveryConfirmationException.Reason.FAILED_TO_CONFIRM_FUTURE_MESSAGES, exception.getReason());
        assertEquals(new OutboundLaneData(1, 0, 1), ledger.outboundLaneData(LANE));
    }
}
