package io.crosslane.dispatch;

import io.crosslane.events.BridgeEventSink;
import io.crosslane.events.MessageDispatchEvent;
import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;
import io.crosslane.model.Weight;
import io.crosslane.payload.AccountDerivation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Dispatch of lanes that carry messages of an embedded cross-consensus protocol.
 * <p>
 * Messages are executed on behalf of the derived root account of the source chain. The executor
 * outcome is only reported: the message always counts as dispatched and no weight is refunded.
 */
public class ForwardingMessageDispatch implements MessageDispatch {
    private static final Logger logger = LogManager.getLogger();

    private final ChainId sourceChain;
    private final ForwardedMessageWeigher weigher;
    private final ForwardedMessageExecutor executor;
    private final Weight weightCredit;
    private final BridgeEventSink eventSink;

    public ForwardingMessageDispatch(ChainId sourceChain, ForwardedMessageWeigher weigher, ForwardedMessageExecutor executor,
                                     Weight weightCredit, BridgeEventSink eventSink) {
        this.sourceChain = sourceChain;
        this.weigher = weigher;
        this.executor = executor;
        this.weightCredit = weightCredit;
        this.eventSink = eventSink;
    }

    @Override
    public Weight dispatchWeight(DispatchMessage message) {
        // an unweighable message must not block the lane
        return weigher.weigh(message.getPayload()).orElse(Weight.ZERO);
    }

    @Override
    public MessageDispatchResult dispatch(AccountId relayer, DispatchMessage message) {
        byte[] payload = message.getPayload();
        Weight weightLimit = dispatchWeight(message);
        AccountId origin = AccountDerivation.deriveRootAccount(sourceChain);
        String detail;
        try {
            boolean completed = executor.execute(origin, payload, weightLimit, weightCredit);
            detail = completed ? "completed" : "incomplete";
        } catch (CallExecutionFailedException e) {
            detail = "failed: " + e.getMessage();
        }
        logger.debug("Forwarded message {} from {} executed with limit {} and credit {}: {}",
                message.getKey(), sourceChain, weightLimit, weightCredit, detail);
        MessageDispatchResult result = MessageDispatchResult.executed(true, Weight.ZERO, false);
        eventSink.deposit(new MessageDispatchEvent(sourceChain, message.getKey(), true, Weight.ZERO,
                Optional.empty(), Optional.of(detail)));
        return result;
    }
}
