package io.crosslane.lane;

import io.crosslane.dispatch.DispatchMessage;
import io.crosslane.dispatch.MessageDispatch;
import io.crosslane.dispatch.MessageDispatchResult;
import io.crosslane.errors.BridgeError;
import io.crosslane.model.AccountId;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;
import io.crosslane.model.Message;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.UnrewardedRelayer;
import io.crosslane.model.Weight;
import io.crosslane.settings.LaneSettings;
import io.crosslane.storage.InMemoryKeyValueStore;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class InboundLaneTest {
    private static final LaneId LANE = LaneId.fromName("roli");
    private static final AccountId RELAYER_A = new AccountId("0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a");
    private static final AccountId RELAYER_B = new AccountId("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");
    private static final AccountId RELAYER_C = new AccountId("0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c");

    private MessageDispatch dispatch;
    private InboundLane lane;

    @Before
    public void setUp() {
        dispatch = mock(MessageDispatch.class);
        when(dispatch.dispatch(any(), any())).thenReturn(MessageDispatchResult.executed(true, Weight.ZERO, false));
        lane = new InboundLane(LANE, new InMemoryKeyValueStore<>(), new LaneSettings(100, 8, 2, 10));
    }

    private static List<Message> messages(long from, long to) {
        List<Message> messages = new ArrayList<>();
        for (long nonce = from; nonce <= to; nonce++) {
            messages.add(new Message(new MessageKey(LANE, nonce), new MessageData(BigInteger.ONE, new byte[]{(byte) nonce})));
        }
        return messages;
    }

    private static UnrewardedRelayer entry(AccountId relayer, long begin, long end) {
        return new UnrewardedRelayer(relayer, new DeliveredMessages(begin, end));
    }

    @Test
    public void whenMessagesAreReceived_theyAreDispatchedInOrderAndNonceAdvancesByBatchSize() throws Exception {
        // Act
        InboundBatchOutcome outcome = lane.receiveMessages(RELAYER_A, messages(1, 3), dispatch);

        // Assert
        assertEquals(0, outcome.getPreviousNonce());
        assertEquals(3, outcome.getLastConfirmedNonce());
        assertEquals(List.of(1L, 2L, 3L), new ArrayList<>(outcome.getDispatchResults().keySet()));
        assertEquals(new InboundLaneData(List.of(entry(RELAYER_A, 1, 3)), 3), lane.data());
        var order = inOrder(dispatch);
        for (long nonce = 1; nonce <= 3; nonce++) {
            MessageKey key = new MessageKey(LANE, nonce);
            order.verify(dispatch).dispatch(eq(RELAYER_A), argThat((DispatchMessage message) -> message.getKey().equals(key)));
        }
    }

    @Test
    public void whenBatchIsResubmitted_nothingIsDispatchedAgain() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 3), dispatch);
        clearInvocations(dispatch);

        // Act
        InboundBatchOutcome outcome = lane.receiveMessages(RELAYER_B, messages(1, 3), dispatch);

        // Assert
        verify(dispatch, never()).dispatch(any(), any());
        assertEquals(List.of(1L, 2L, 3L), outcome.getDuplicateNonces());
        assertEquals(3, outcome.getLastConfirmedNonce());
        assertEquals(new InboundLaneData(List.of(entry(RELAYER_A, 1, 3)), 3), lane.data());
    }

    @Test
    public void whenBatchOverlapsReceivedMessages_onlyNewOnesAreDispatched() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 2), dispatch);
        clearInvocations(dispatch);

        // Act
        InboundBatchOutcome outcome = lane.receiveMessages(RELAYER_B, messages(1, 4), dispatch);

        // Assert
        verify(dispatch, times(2)).dispatch(any(), any());
        assertEquals(List.of(1L, 2L), outcome.getDuplicateNonces());
        assertEquals(new InboundLaneData(List.of(entry(RELAYER_A, 1, 2), entry(RELAYER_B, 3, 4)), 4), lane.data());
    }

    @Test
    public void whenNonceIsSkipped_wholeBatchIsRejectedBeforeDispatch() {
        // Arrange
        List<Message> gap = new ArrayList<>(messages(1, 2));
        gap.addAll(messages(4, 4));

        // Act
        LaneException exception = assertThrows(LaneException.class, () -> lane.receiveMessages(RELAYER_A, gap, dispatch));

        // Assert
        assertEquals(BridgeError.OUT_OF_ORDER_NONCE, exception.getError());
        verify(dispatch, never()).dispatch(any(), any());
        assertEquals(InboundLaneData.DEFAULT, lane.data());
    }

    @Test
    public void whenSameRelayerContinues_itsEntryIsExtended() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 2), dispatch);

        // Act
        lane.receiveMessages(RELAYER_A, messages(3, 5), dispatch);

        // Assert
        assertEquals(new InboundLaneData(List.of(entry(RELAYER_A, 1, 5)), 5), lane.data());
    }

    @Test
    public void whenTooManyRelayerEntries_batchIsRejected() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 1), dispatch);
        lane.receiveMessages(RELAYER_B, messages(2, 2), dispatch);

        // Act
        LaneException exception = assertThrows(LaneException.class, () -> lane.receiveMessages(RELAYER_C, messages(3, 3), dispatch));
        InboundBatchOutcome sameRelayer = lane.receiveMessages(RELAYER_B, messages(3, 3), dispatch);

        // Assert
        assertEquals(BridgeError.TOO_MANY_UNREWARDED_RELAYERS, exception.getError());
        assertEquals(3, sameRelayer.getLastConfirmedNonce());
    }

    @Test
    public void whenTooManyUnconfirmedMessages_batchIsRejected() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 8), dispatch);

        // Act
        LaneException exception = assertThrows(LaneException.class, () -> lane.receiveMessages(RELAYER_A, messages(9, 11), dispatch));

        // Assert
        assertEquals(BridgeError.TOO_MANY_UNCONFIRMED_MESSAGES, exception.getError());
        assertEquals(8, lane.data().getLastConfirmedNonce());
    }

    @Test
    public void whenSourceLaneStateIsReceived_rewardedEntriesAreDropped() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 3), dispatch);
        lane.receiveMessages(RELAYER_B, messages(4, 6), dispatch);

        // Act
        InboundLaneData updated = lane.receiveStateUpdate(new OutboundLaneData(1, 4, 6));

        // Assert
        assertEquals(new InboundLaneData(List.of(entry(RELAYER_B, 5, 6)), 6), updated);
        assertEquals(updated, lane.data());
    }

    @Test
    public void whenLaneStateComesWithMessages_freedEntriesMakeRoomForTheBatch() throws Exception {
        // Arrange
        lane.receiveMessages(RELAYER_A, messages(1, 8), dispatch);

        // Act
        InboundBatchOutcome outcome = lane.receiveMessages(RELAYER_B, Optional.of(new OutboundLaneData(1, 8, 11)), messages(9, 11), dispatch);

        // Assert
        assertEquals(11, outcome.getLastConfirmedNonce());
        assertEquals(new InboundLaneData(List.of(entry(RELAYER_B, 9, 11)), 11), lane.data());
    }
}
