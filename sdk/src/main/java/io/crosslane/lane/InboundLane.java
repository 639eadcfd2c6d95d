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
import io.crosslane.model.OutboundLaneData;
import io.crosslane.model.UnrewardedRelayer;
import io.crosslane.settings.LaneSettings;
import io.crosslane.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Receiving side of a lane. Messages are dispatched strictly in nonce order, each of them once.
 */
public class InboundLane {
    private static final Logger logger = LogManager.getLogger();

    static final String OUT_OF_ORDER = "Lane %s expects nonce %d, got %d";
    static final String TOO_MANY_RELAYERS = "Lane %s already has %d unrewarded relayer entries";
    static final String TOO_MANY_UNCONFIRMED = "Lane %s would hold %d unconfirmed messages, at most %d allowed";

    private final LaneId laneId;
    private final KeyValueStore<LaneId, InboundLaneData> lanes;
    private final LaneSettings settings;

    public InboundLane(LaneId laneId, KeyValueStore<LaneId, InboundLaneData> lanes, LaneSettings settings) {
        this.laneId = laneId;
        this.lanes = lanes;
        this.settings = settings;
    }

    public LaneId getLaneId() {
        return laneId;
    }

    public InboundLaneData data() {
        return lanes.getOrElse(laneId, InboundLaneData.DEFAULT);
    }

    /**
     * Drops relayer entries the sending side has already rewarded. An entry rewarded in part keeps its tail.
     */
    static InboundLaneData applyStateUpdate(InboundLaneData data, OutboundLaneData outboundLane) {
        long rewardedUpTo = outboundLane.getLatestReceivedNonce();
        List<UnrewardedRelayer> relayers = new ArrayList<>();
        for (UnrewardedRelayer entry : data.getRelayers()) {
            DeliveredMessages messages = entry.getMessages();
            if (messages.getEnd() <= rewardedUpTo)
                continue;
            if (messages.getBegin() <= rewardedUpTo)
                relayers.add(new UnrewardedRelayer(entry.getRelayer(), new DeliveredMessages(rewardedUpTo + 1, messages.getEnd())));
            else
                relayers.add(entry);
        }
        return new InboundLaneData(relayers, data.getLastConfirmedNonce());
    }

    /**
     * Applies the proven state of the bridged outbound lane on its own.
     *
     * @return the updated lane data
     */
    public InboundLaneData receiveStateUpdate(OutboundLaneData outboundLane) {
        InboundLaneData updated = applyStateUpdate(data(), outboundLane);
        lanes.put(laneId, updated);
        return updated;
    }

    public InboundBatchOutcome receiveMessages(AccountId relayer, List<Message> messages, MessageDispatch dispatch) throws LaneException {
        return receiveMessages(relayer, Optional.empty(), messages, dispatch);
    }

    /**
     * Receives proven messages and the proven state of the bridged outbound lane.
     * <p>
     * Messages at or below the last confirmed nonce are skipped. The others must follow it without gaps,
     * otherwise the batch is rejected before anything is dispatched or written. The last confirmed nonce is
     * written once, after the whole batch has been dispatched.
     */
    public InboundBatchOutcome receiveMessages(AccountId relayer, Optional<OutboundLaneData> outboundLane,
                                               List<Message> messages, MessageDispatch dispatch) throws LaneException {
        InboundLaneData current = data();
        InboundLaneData data = outboundLane.map(state -> applyStateUpdate(current, state)).orElse(current);
        long previousNonce = data.getLastConfirmedNonce();

        List<Long> duplicates = new ArrayList<>();
        List<Message> fresh = new ArrayList<>();
        for (Message message : messages) {
            if (message.nonce() <= previousNonce)
                duplicates.add(message.nonce());
            else
                fresh.add(message);
        }
        checkBatch(data, relayer, fresh);

        Map<Long, MessageDispatchResult> results = new LinkedHashMap<>();
        for (Message message : fresh) {
            results.put(message.nonce(), dispatch.dispatch(relayer, DispatchMessage.from(message)));
        }

        long lastNonce = previousNonce + fresh.size();
        List<UnrewardedRelayer> relayers = new ArrayList<>(data.getRelayers());
        if (!fresh.isEmpty()) {
            int tail = relayers.size() - 1;
            if (tail >= 0 && relayers.get(tail).getRelayer().equals(relayer))
                relayers.set(tail, new UnrewardedRelayer(relayer, relayers.get(tail).getMessages().extendTo(lastNonce)));
            else
                relayers.add(new UnrewardedRelayer(relayer, new DeliveredMessages(previousNonce + 1, lastNonce)));
        }
        lanes.put(laneId, new InboundLaneData(relayers, lastNonce));

        if (!duplicates.isEmpty())
            logger.debug("Lane {}: skipped already received nonces {} ({})", laneId, duplicates, BridgeError.DUPLICATE_MESSAGE);
        logger.info("Lane {}: received {} messages from relayer {}, last confirmed nonce {}", laneId, fresh.size(), relayer, lastNonce);
        return new InboundBatchOutcome(laneId, previousNonce, lastNonce, duplicates, results);
    }

    private void checkBatch(InboundLaneData data, AccountId relayer, List<Message> fresh) throws LaneException {
        long expected = data.getLastConfirmedNonce() + 1;
        for (Message message : fresh) {
            if (message.nonce() != expected)
                throw new LaneException(BridgeError.OUT_OF_ORDER_NONCE, String.format(OUT_OF_ORDER, laneId, expected, message.nonce()));
            expected++;
        }
        if (fresh.isEmpty())
            return;

        List<UnrewardedRelayer> relayers = data.getRelayers();
        boolean extendsTail = !relayers.isEmpty() && relayers.get(relayers.size() - 1).getRelayer().equals(relayer);
        if (!extendsTail && relayers.size() >= settings.getMaxUnrewardedRelayerEntries())
            throw new LaneException(BridgeError.TOO_MANY_UNREWARDED_RELAYERS, String.format(TOO_MANY_RELAYERS, laneId, relayers.size()));
        long unconfirmed = data.unrewardedMessagesCount() + fresh.size();
        if (unconfirmed > settings.getMaxUnconfirmedMessages())
            throw new LaneException(BridgeError.TOO_MANY_UNCONFIRMED_MESSAGES,
                    String.format(TOO_MANY_UNCONFIRMED, laneId, unconfirmed, settings.getMaxUnconfirmedMessages()));
    }
}
