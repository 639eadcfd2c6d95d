package io.crosslane.events;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.errors.BridgeError;
import io.crosslane.model.ChainId;
import io.crosslane.model.MessageKey;
import io.crosslane.model.Weight;

import java.util.Optional;

/**
 * Terminal event of a message dispatch. Exactly one is deposited per dispatched message.
 */
@JsonView(Views.Default.class)
public final class MessageDispatchEvent extends BridgeEvent {
    private final ChainId sourceChain;
    private final MessageKey key;
    private final boolean dispatchResult;
    private final Weight unspentWeight;
    private final BridgeError rejection;
    private final String detail;

    public MessageDispatchEvent(ChainId sourceChain, MessageKey key, boolean dispatchResult, Weight unspentWeight,
                                Optional<BridgeError> rejection, Optional<String> detail) {
        this.sourceChain = sourceChain;
        this.key = key;
        this.dispatchResult = dispatchResult;
        this.unspentWeight = unspentWeight;
        this.rejection = rejection.orElse(null);
        this.detail = detail.orElse(null);
    }

    public ChainId getSourceChain() {
        return sourceChain;
    }

    public MessageKey getKey() {
        return key;
    }

    public boolean getDispatchResult() {
        return dispatchResult;
    }

    public Weight getUnspentWeight() {
        return unspentWeight;
    }

    public Optional<BridgeError> getRejection() {
        return Optional.ofNullable(rejection);
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public String toString() {
        return "MessageDispatchEvent{sourceChain=" + sourceChain + ", key=" + key + ", dispatchResult=" + dispatchResult
                + ", unspentWeight=" + unspentWeight + ", rejection=" + rejection + ", detail=" + detail + "}";
    }
}
