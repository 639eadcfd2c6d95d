package io.crosslane.settings;

import io.crosslane.model.ChainId;
import io.crosslane.model.LaneId;

import java.util.Collections;
import java.util.List;

/**
 * All settings of a bridge between this chain and one bridged chain.
 */
public final class BridgeSettings {
    private final ChainId thisChain;
    private final ChainId bridgedChainId;
    private final List<LaneId> lanes;
    private final LaneSettings laneSettings;
    private final BridgedChainSettings bridgedChain;
    private final FeeMarketSettings feeMarket;
    private final DispatchSettings dispatch;
    private final long maxFutureNumberDifference;
    private final LogInfo logInfo;

    public BridgeSettings(ChainId thisChain, ChainId bridgedChainId, List<LaneId> lanes, LaneSettings laneSettings,
                          BridgedChainSettings bridgedChain, FeeMarketSettings feeMarket, DispatchSettings dispatch,
                          long maxFutureNumberDifference, LogInfo logInfo) {
        if (thisChain.equals(bridgedChainId))
            throw new IllegalArgumentException(String.format("Chain `%s` can not be bridged with itself", thisChain));
        this.thisChain = thisChain;
        this.bridgedChainId = bridgedChainId;
        this.lanes = Collections.unmodifiableList(lanes);
        this.laneSettings = laneSettings;
        this.bridgedChain = bridgedChain;
        this.feeMarket = feeMarket;
        this.dispatch = dispatch;
        this.maxFutureNumberDifference = maxFutureNumberDifference;
        this.logInfo = logInfo;
    }

    public ChainId getThisChain() {
        return thisChain;
    }

    public ChainId getBridgedChainId() {
        return bridgedChainId;
    }

    // Lanes open for outbound messages
    public List<LaneId> getLanes() {
        return lanes;
    }

    public LaneSettings getLaneSettings() {
        return laneSettings;
    }

    public BridgedChainSettings getBridgedChain() {
        return bridgedChain;
    }

    public FeeMarketSettings getFeeMarket() {
        return feeMarket;
    }

    public DispatchSettings getDispatch() {
        return dispatch;
    }

    public long getMaxFutureNumberDifference() {
        return maxFutureNumberDifference;
    }

    public LogInfo getLogInfo() {
        return logInfo;
    }
}
