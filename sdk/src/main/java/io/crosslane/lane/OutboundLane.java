package io.crosslane.lane;

import io.crosslane.lane.DeliveryConfirmationException.Reason;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageData;
import io.crosslane.model.MessageKey;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.UnrewardedRelayer;
import io.crosslane.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Sending side of a lane: stores messages until their delivery is confirmed and their rewards are paid.
 */
public class OutboundLane {
    private static final Logger logger = LogManager.getLogger();

    static final String FUTURE_MESSAGES = "Confirmation of nonce %d, but only %d messages have been sent";
    static final String TOO_MANY_MESSAGES = "Confirmation of %d messages, at most %d expected";
    static final String EMPTY_RELAYERS = "Confirmation of nonces up to %d without relayer entries";
    static final String NON_CONSECUTIVE_RELAYERS = "Relayer entries do not cover nonces %d..=%d consecutively";

    private final LaneId laneId;
    private final KeyValueStore<LaneId, OutboundLaneData> lanes;
    private final KeyValueStore<MessageKey, MessageData> messages;

    public OutboundLane(LaneId laneId, KeyValueStore<LaneId, OutboundLaneData> lanes, KeyValueStore<MessageKey, MessageData> messages) {
        this.laneId = laneId;
        this.lanes = lanes;
        this.messages = messages;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public OutboundLaneData data() {
        return lanes.getOrElse(laneId, OutboundLaneData.DEFAULT);
    }

    /**
     * @return nonce assigned to the message
     */
    public long sendMessage(MessageData message) {
        OutboundLaneData data = data();
        long nonce = data.getLatestGeneratedNonce() + 1;
        messages.put(new MessageKey(laneId, nonce), message);
        lanes.put(laneId, data.withLatestGeneratedNonce(nonce));
        return nonce;
    }

    public Optional<MessageData> message(long nonce) {
        return messages.get(new MessageKey(laneId, nonce));
    }

    /**
     * Confirms delivery of all messages up to `latestDeliveredNonce`.
     *
     * @param relayers relayer entries proven by the bridged chain, they must cover every newly confirmed nonce
     * @return the newly confirmed range, empty if nothing new is confirmed
     * @throws DeliveryConfirmationException if the confirmation contradicts the lane state, in which case nothing is changed
     */
    public Optional<DeliveredMessages> confirmDelivery(long maxAllowedMessages, long latestDeliveredNonce,
                                                       List<UnrewardedRelayer> relayers) throws DeliveryConfirmationException {
        OutboundLaneData data = data();
        if (latestDeliveredNonce <= data.getLatestReceivedNonce())
            return Optional.empty();
        if (latestDeliveredNonce > data.getLatestGeneratedNonce())
            throw new DeliveryConfirmationException(Reason.FAILED_TO_CONFIRM_FUTURE_MESSAGES,
                    String.format(FUTURE_MESSAGES, latestDeliveredNonce, data.getLatestGeneratedNonce()));

        DeliveredMessages confirmed = new DeliveredMessages(data.getLatestReceivedNonce() + 1, latestDeliveredNonce);
        if (confirmed.totalMessages() > maxAllowedMessages)
            throw new DeliveryConfirmationException(Reason.TRYING_TO_CONFIRM_MORE_MESSAGES_THAN_EXPECTED,
                    String.format(TOO_MANY_MESSAGES, confirmed.totalMessages(), maxAllowedMessages));
        ensureRelayersCover(relayers, confirmed);

        lanes.put(laneId, data.withLatestReceivedNonce(latestDeliveredNonce));
        logger.debug("Lane {}: delivery of messages {} confirmed", laneId, confirmed);
        return Optional.of(confirmed);
    }

    private static void ensureRelayersCover(List<UnrewardedRelayer> relayers, DeliveredMessages confirmed) throws DeliveryConfirmationException {
        if (relayers.isEmpty())
            throw new DeliveryConfirmationException(Reason.EMPTY_UNREWARDED_RELAYER_ENTRY, String.format(EMPTY_RELAYERS, confirmed.getEnd()));
        long expectedBegin = relayers.get(0).getMessages().getBegin();
        for (UnrewardedRelayer entry : relayers) {
            if (entry.getMessages().getBegin() != expectedBegin)
                throw new DeliveryConfirmationException(Reason.NON_CONSECUTIVE_UNREWARDED_RELAYER_ENTRIES,
                        String.format(NON_CONSECUTIVE_RELAYERS, confirmed.getBegin(), confirmed.getEnd()));
            expectedBegin = entry.getMessages().getEnd() + 1;
        }
        long first = relayers.get(0).getMessages().getBegin();
        long last = relayers.get(relayers.size() - 1).getMessages().getEnd();
        if (first > confirmed.getBegin() || last != confirmed.getEnd())
            throw new DeliveryConfirmationException(Reason.NON_CONSECUTIVE_UNREWARDED_RELAYER_ENTRIES,
                    String.format(NON_CONSECUTIVE_RELAYERS, confirmed.getBegin(), confirmed.getEnd()));
    }

    /**
     * Removes confirmed messages whose rewards have been paid, oldest first, at most `maxMessagesToPrune` of them.
     *
     * @return number of pruned messages
     */
    public int pruneMessages(int maxMessagesToPrune, Predicate<MessageKey> isSettled) {
        OutboundLaneData data = data();
        long nonce = data.getOldestUnprunedNonce();
        int pruned = 0;
        while (pruned < maxMessagesToPrune && nonce <= data.getLatestReceivedNonce()) {
            MessageKey key = new MessageKey(laneId, nonce);
            if (!isSettled.test(key))
                break;
            messages.remove(key);
            nonce++;
            pruned++;
        }
        if (pruned > 0) {
            lanes.put(laneId, data.withOldestUnprunedNonce(nonce));
            logger.trace("Lane {}: pruned {} messages, oldest unpruned nonce is {}", laneId, pruned, nonce);
        }
        return pruned;
    }
}
