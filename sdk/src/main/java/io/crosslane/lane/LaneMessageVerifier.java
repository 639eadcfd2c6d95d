package io.crosslane.lane;

import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;
import io.crosslane.fee.FeeMarket;
import io.crosslane.model.LaneId;
import io.crosslane.model.OutboundLaneData;
import io.crosslane.payload.MessageOriginVerifier;
import io.crosslane.payload.MessagePayload;
import io.crosslane.payload.RawOrigin;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Checks an outbound message may be sent over a lane.
 */
public class LaneMessageVerifier {
    static final String LANE_REJECTED = "The outbound message lane has rejected the message.";
    static final String TOO_MANY_PENDING = "Too many pending messages at the lane.";
    static final String FEE_TOO_LOW = "Provided fee is below minimal threshold required by the lane.";
    static final String MARKET_NOT_READY = "The fee market is not ready for accepting messages.";

    private final ThisChainCapabilities thisChain;
    private final FeeMarket feeMarket;

    public LaneMessageVerifier(ThisChainCapabilities thisChain, FeeMarket feeMarket) {
        this.thisChain = thisChain;
        this.feeMarket = feeMarket;
    }

    public void verifyMessage(RawOrigin submitter, BigInteger fee, LaneId laneId, OutboundLaneData laneData,
                              MessagePayload payload) throws BridgeException {
        if (!thisChain.accepts(submitter, laneId))
            throw new LaneException(BridgeError.MESSAGE_REJECTED_BY_LANE, LANE_REJECTED);

        if (laneData.pendingMessages() >= thisChain.maxPendingMessages())
            throw new LaneException(BridgeError.TOO_MANY_PENDING_MESSAGES, TOO_MANY_PENDING);

        MessageOriginVerifier.verifyMessageOrigin(submitter, payload);

        Optional<BigInteger> marketFee = feeMarket.marketFee();
        if (marketFee.isEmpty())
            throw new LaneException(BridgeError.FEE_MARKET_NOT_READY, MARKET_NOT_READY);
        if (fee.compareTo(marketFee.get()) < 0)
            throw new LaneException(BridgeError.TOO_LOW_FEE, FEE_TOO_LOW);
    }
}
