package io.crosslane.dispatch;

import io.crosslane.errors.BridgeError;
import io.crosslane.model.Weight;

import java.util.Optional;

public final class MessageDispatchResult {
    private final boolean dispatchResult;
    private final Weight unspentWeight;
    private final boolean dispatchFeePaidDuringDispatch;
    private final DispatchStage stage;
    private final BridgeError rejection;

    private MessageDispatchResult(boolean dispatchResult, Weight unspentWeight, boolean dispatchFeePaidDuringDispatch,
                                  DispatchStage stage, BridgeError rejection) {
        this.dispatchResult = dispatchResult;
        this.unspentWeight = unspentWeight;
        this.dispatchFeePaidDuringDispatch = dispatchFeePaidDuringDispatch;
        this.stage = stage;
        this.rejection = rejection;
    }

    public static MessageDispatchResult rejected(BridgeError reason, DispatchStage stage, Weight unspentWeight,
                                                 boolean dispatchFeePaid) {
        return new MessageDispatchResult(false, unspentWeight, dispatchFeePaid, stage, reason);
    }

    public static MessageDispatchResult executed(boolean succeeded, Weight unspentWeight, boolean dispatchFeePaid) {
        return new MessageDispatchResult(succeeded, unspentWeight, dispatchFeePaid, DispatchStage.DISPATCHED, null);
    }

    // False if the message has been rejected or the call has failed
    public boolean getDispatchResult() {
        return dispatchResult;
    }

    public Weight getUnspentWeight() {
        return unspentWeight;
    }

    public boolean isDispatchFeePaidDuringDispatch() {
        return dispatchFeePaidDuringDispatch;
    }

    public DispatchStage getStage() {
        return stage;
    }

    public Optional<BridgeError> getRejection() {
        return Optional.ofNullable(rejection);
    }

    @Override
    public String toString() {
        return "MessageDispatchResult{dispatchResult=" + dispatchResult + ", unspentWeight=" + unspentWeight
                + ", dispatchFeePaidDuringDispatch=" + dispatchFeePaidDuringDispatch + ", stage=" + stage
                + ", rejection=" + rejection + "}";
    }
}
