package io.crosslane.lane;

import io.crosslane.dispatch.DispatchMessage;
import io.crosslane.dispatch.MessageDispatch;
import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;
import io.crosslane.events.BridgeEventSink;
import io.crosslane.events.LaneAdvanceRecord;
import io.crosslane.events.MessageAcceptedEvent;
import io.crosslane.events.MessagesDeliveredEvent;
import io.crosslane.fee.FeeMarket;
import io.crosslane.fee.FeeMarketPayment;
import io.crosslane.fee.RewardSettlement;
import io.crosslane.model.AccountId;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.InboundLaneData;
import io.crosslane.model.LaneId;
import io.crosslane.model.Message;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.Weight;
import io.crosslane.payload.MessagePayload;
import io.crosslane.payload.RawOrigin;
import io.crosslane.proof.MessageProofException;
import io.crosslane.proof.MessagesDeliveryProof;
import io.crosslane.proof.MessagesProof;
import io.crosslane.proof.MessagesProofVerifier;
import io.crosslane.proof.ParsedDeliveryProof;
import io.crosslane.proof.ProvedLaneMessages;
import io.crosslane.settings.LaneSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Message lanes between this chain and one bridged chain.
 * <p>
 * Every operation either completes or fails without changing any state. Calls must not run concurrently.
 */
public class MessagesLedger {
    private static final Logger logger = LogManager.getLogger();

    static final String NEGATIVE_MESSAGES_COUNT = "Claimed messages count %d is negative";
    static final String TOO_MANY_MESSAGES = "Claimed messages count %d exceeds the limit of %d messages per proof";
    static final String DISPATCH_WEIGHT_TOO_LOW = "Declared dispatch weight %s does not cover weight %s of the proven messages";

    private final LaneSettings laneSettings;
    private final ChainMessageVerifier chainMessageVerifier;
    private final LaneMessageVerifier laneMessageVerifier;
    private final MessagesProofVerifier proofVerifier;
    private final MessageDispatch messageDispatch;
    private final FeeMarket feeMarket;
    private final FeeMarketPayment payment;
    private final LaneStores stores;
    private final BridgeEventSink eventSink;
    private final LongSupplier blockNumber;

    public MessagesLedger(LaneSettings laneSettings, ChainMessageVerifier chainMessageVerifier,
                          LaneMessageVerifier laneMessageVerifier, MessagesProofVerifier proofVerifier,
                          MessageDispatch messageDispatch, FeeMarket feeMarket, FeeMarketPayment payment,
                          LaneStores stores, BridgeEventSink eventSink, LongSupplier blockNumber) {
        this.laneSettings = laneSettings;
        this.chainMessageVerifier = chainMessageVerifier;
        this.laneMessageVerifier = laneMessageVerifier;
        this.proofVerifier = proofVerifier;
        this.messageDispatch = messageDispatch;
        this.feeMarket = feeMarket;
        this.payment = payment;
        this.stores = stores;
        this.eventSink = eventSink;
        this.blockNumber = blockNumber;
    }

    private OutboundLane outboundLane(LaneId laneId) {
        return new OutboundLane(laneId, stores.getOutboundLanes(), stores.getOutboundMessages());
    }

    private InboundLane inboundLane(LaneId laneId) {
        return new InboundLane(laneId, stores.getInboundLanes(), laneSettings);
    }

    /**
     * Sends a message to the bridged chain. The fee is moved to the relayer fund and an order is created
     * for the relayers assigned at this block.
     *
     * @return nonce of the message
     */
    public long sendMessage(RawOrigin submitter, LaneId laneId, MessagePayload payload, BigInteger fee) throws BridgeException {
        byte[] encodedPayload = payload.bytes();
        chainMessageVerifier.verifyChainMessage(encodedPayload, payload.getWeight());

        OutboundLane lane = outboundLane(laneId);
        OutboundLaneData data = lane.data();
        laneMessageVerifier.verifyMessage(submitter, fee, laneId, data, payload);
        payment.payDeliveryAndDispatchFee(submitter, fee);

        long now = blockNumber.getAsLong();
        MessageKey key = new MessageKey(laneId, data.getLatestGeneratedNonce() + 1);
        feeMarket.createOrder(key, fee, now);
        long nonce = lane.sendMessage(new MessageData(fee, encodedPayload));
        lane.pruneMessages(laneSettings.getMaxMessagesToPruneAtOnce(), feeMarket::isSettled);

        eventSink.deposit(new MessageAcceptedEvent(key, fee));
        logger.info("Message {} accepted at block {} with fee {}", key, now, fee);
        return nonce;
    }

    /**
     * Receives messages proven to be stored at the bridged chain.
     *
     * @param messagesCount          number of messages the relayer claims the proof carries
     * @param declaredDispatchWeight weight the relayer has paid for, it must cover every message of the proof
     */
    public InboundBatchOutcome receiveMessagesProof(AccountId relayer, MessagesProof proof, int messagesCount,
                                                    Weight declaredDispatchWeight) throws BridgeException {
        if (messagesCount < 0)
            throw new LaneException(BridgeError.PROOF_COUNT_MISMATCH, String.format(NEGATIVE_MESSAGES_COUNT, messagesCount));
        // a proof can not deliver more than the inbound lane accepts unconfirmed
        if (messagesCount > laneSettings.getMaxUnconfirmedMessages()) {
            logger.warn("Messages proof {} from relayer {} claims {} messages, limit is {}", proof, relayer,
                    messagesCount, laneSettings.getMaxUnconfirmedMessages());
            throw new LaneException(BridgeError.TOO_MANY_MESSAGES_IN_PROOF,
                    String.format(TOO_MANY_MESSAGES, messagesCount, laneSettings.getMaxUnconfirmedMessages()));
        }

        Map<LaneId, ProvedLaneMessages> proved;
        try {
            proved = proofVerifier.verifyMessagesProof(proof, messagesCount);
        } catch (MessageProofException e) {
            logger.warn("Messages proof {} from relayer {} rejected: {}", proof, relayer, e.getMessage());
            throw e;
        }

        Weight actualWeight = Weight.ZERO;
        for (ProvedLaneMessages laneMessages : proved.values()) {
            for (Message message : laneMessages.getMessages()) {
                actualWeight = actualWeight.add(messageDispatch.dispatchWeight(DispatchMessage.from(message)));
            }
        }
        if (declaredDispatchWeight.isLessThan(actualWeight)) {
            logger.warn("Messages proof {} from relayer {} declares weight {}, messages need {}", proof, relayer,
                    declaredDispatchWeight, actualWeight);
            throw new LaneException(BridgeError.INVALID_DISPATCH_WEIGHT,
                    String.format(DISPATCH_WEIGHT_TOO_LOW, declaredDispatchWeight, actualWeight));
        }

        InboundBatchOutcome outcome = null;
        for (Map.Entry<LaneId, ProvedLaneMessages> entry : proved.entrySet()) {
            ProvedLaneMessages laneMessages = entry.getValue();
            InboundBatchOutcome laneOutcome = inboundLane(entry.getKey())
                    .receiveMessages(relayer, laneMessages.getLaneState(), laneMessages.getMessages(), messageDispatch);
            eventSink.deposit(new LaneAdvanceRecord(entry.getKey(), relayer, laneOutcome.getPreviousNonce(),
                    laneOutcome.getLastConfirmedNonce(), laneOutcome.getDuplicateNonces().size()));
            if (entry.getKey().equals(proof.getLaneId()))
                outcome = laneOutcome;
        }
        return outcome;
    }

    /**
     * Confirms delivery of outbound messages proven by the inbound lane state of the bridged chain, then pays
     * the relayers of the confirmed messages and prunes settled messages.
     */
    public DeliveryConfirmationOutcome receiveMessagesDeliveryProof(AccountId confirmRelayer, MessagesDeliveryProof proof)
            throws BridgeException {
        ParsedDeliveryProof parsed = proofVerifier.verifyMessagesDeliveryProof(proof);
        LaneId laneId = parsed.getLaneId();
        InboundLaneData bridgedInbound = parsed.getInboundLaneData();
        OutboundLane lane = outboundLane(laneId);

        Optional<DeliveredMessages> confirmed;
        try {
            confirmed = lane.confirmDelivery(laneSettings.getMaxUnconfirmedMessages(),
                    bridgedInbound.getLastConfirmedNonce(), bridgedInbound.getRelayers());
        } catch (DeliveryConfirmationException e) {
            logger.warn("Delivery proof of lane {} from relayer {} rejected: {} ({})", laneId, confirmRelayer,
                    e.getMessage(), e.getReason());
            throw e;
        }
        Optional<RewardSettlement> settlement = Optional.empty();
        if (confirmed.isPresent()) {
            long now = blockNumber.getAsLong();
            feeMarket.onMessagesDelivered(laneId, confirmed.get(), now);
            settlement = Optional.of(payment.payRelayersRewards(laneId, bridgedInbound.getRelayers(), confirmRelayer, confirmed.get(), now));
            eventSink.deposit(new MessagesDeliveredEvent(laneId, confirmed.get()));
        } else {
            logger.debug("Lane {}: delivery proof confirms no new messages", laneId);
        }
        int pruned = lane.pruneMessages(laneSettings.getMaxMessagesToPruneAtOnce(), feeMarket::isSettled);
        return new DeliveryConfirmationOutcome(laneId, confirmed, settlement, pruned);
    }

    public OutboundLaneData outboundLaneData(LaneId laneId) {
        return outboundLane(laneId).data();
    }

    public InboundLaneData inboundLaneData(LaneId laneId) {
        return inboundLane(laneId).data();
    }

    public Optional<MessageData> outboundMessage(LaneId laneId, long nonce) {
        return outboundLane(laneId).message(nonce);
    }
}
