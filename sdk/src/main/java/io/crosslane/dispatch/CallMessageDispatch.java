package io.crosslane.dispatch;

import io.crosslane.errors.BridgeError;
import io.crosslane.events.BridgeEventSink;
import io.crosslane.events.MessageDispatchEvent;
import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;
import io.crosslane.model.MessageKey;
import io.crosslane.model.Weight;
import io.crosslane.payload.DispatchFeePayment;
import io.crosslane.payload.MessagePayload;
import io.crosslane.payload.MessagePayloadSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Dispatches bridged messages carrying a {@link MessagePayload} as calls of this chain.
 * <p>
 * A message is checked in a fixed order: spec version, call decoding, origin, call policy, declared weight
 * and, if the sender asked for it, dispatch fee payment. The first failing check rejects the message and
 * the call is not executed. The weight the sender paid for and that was not used is reported back as unspent.
 *
 * @param <C> decoded call type
 */
public class CallMessageDispatch<C> implements MessageDispatch {
    private static final Logger logger = LogManager.getLogger();

    private final ChainId sourceChain;
    private final ChainId thisChain;
    private final int specVersion;
    private final CallDispatcher<C> callDispatcher;
    private final CallValidator<C> callValidator;
    private final DispatchFeePayer feePayer;
    private final BridgeEventSink eventSink;

    public CallMessageDispatch(ChainId sourceChain, ChainId thisChain, int specVersion,
                               CallDispatcher<C> callDispatcher, CallValidator<C> callValidator,
                               DispatchFeePayer feePayer, BridgeEventSink eventSink) {
        this.sourceChain = Objects.requireNonNull(sourceChain);
        this.thisChain = Objects.requireNonNull(thisChain);
        this.specVersion = specVersion;
        this.callDispatcher = Objects.requireNonNull(callDispatcher);
        this.callValidator = Objects.requireNonNull(callValidator);
        this.feePayer = Objects.requireNonNull(feePayer);
        this.eventSink = Objects.requireNonNull(eventSink);
    }

    @Override
    public Weight dispatchWeight(DispatchMessage message) {
        return parsePayload(message).map(MessagePayload::getWeight).orElse(Weight.ZERO);
    }

    @Override
    public MessageDispatchResult dispatch(AccountId relayer, DispatchMessage message) {
        MessageKey key = message.getKey();
        Optional<MessagePayload> parsed = parsePayload(message);
        if (parsed.isEmpty()) {
            return report(key, MessageDispatchResult.rejected(BridgeError.MESSAGE_REJECTED, DispatchStage.RECEIVED, Weight.ZERO, false),
                    "payload can not be decoded");
        }
        MessagePayload payload = parsed.get();
        Weight declaredWeight = payload.getWeight();

        if (payload.getSpecVersion() != specVersion) {
            return reject(key, BridgeError.VERSION_MISMATCH, DispatchStage.RECEIVED, declaredWeight, false,
                    String.format("expected spec version %d, got %d", specVersion, payload.getSpecVersion()));
        }

        C call;
        try {
            call = callDispatcher.decode(payload.getCall());
        } catch (CallDecodeException e) {
            return reject(key, BridgeError.DECODE_FAILURE, DispatchStage.VERSION_CHECKED, declaredWeight, false, e.getMessage());
        }

        Optional<AccountId> origin = payload.getOrigin().dispatchAccount(payload, sourceChain, thisChain);
        if (origin.isEmpty()) {
            return reject(key, BridgeError.SIGNATURE_MISMATCH, DispatchStage.DECODED, declaredWeight, false,
                    "target account signature does not match");
        }

        try {
            callValidator.validate(relayer, origin.get(), call);
        } catch (CallValidationException e) {
            return reject(key, BridgeError.ORIGIN_REJECTED, DispatchStage.ORIGIN_DERIVED, declaredWeight, false, e.getMessage());
        }

        Weight minimalWeight = callDispatcher.minimalWeight(call);
        if (declaredWeight.isLessThan(minimalWeight)) {
            return reject(key, BridgeError.WEIGHT_MISMATCH, DispatchStage.CALL_VALIDATED, declaredWeight, false,
                    String.format("expected weight %d, got %d", minimalWeight.value(), declaredWeight.value()));
        }

        boolean feePaid = false;
        if (payload.getDispatchFeePayment() == DispatchFeePayment.AT_TARGET_CHAIN) {
            try {
                feePayer.payDispatchFee(origin.get(), declaredWeight);
                feePaid = true;
            } catch (DispatchFeePaymentException e) {
                return reject(key, BridgeError.FEE_PAYMENT_FAILED, DispatchStage.WEIGHT_CHECKED, declaredWeight, false,
                        String.format("account %s can not pay for weight %d: %s", origin.get(), declaredWeight.value(), e.getMessage()));
            }
        }

        try {
            Weight consumed = callDispatcher.execute(origin.get(), call).orElse(declaredWeight);
            return report(key, MessageDispatchResult.executed(true, declaredWeight.saturatingSub(consumed), feePaid), null);
        } catch (CallExecutionFailedException e) {
            return report(key, MessageDispatchResult.executed(false, Weight.ZERO, feePaid), e.getMessage());
        }
    }

    private Optional<MessagePayload> parsePayload(DispatchMessage message) {
        try {
            return Optional.of(MessagePayloadSerializer.getSerializer().parseBytes(message.getPayload()));
        } catch (IllegalArgumentException e) {
            logger.debug("Payload of message {} can not be decoded: {}", message.getKey(), e.getMessage());
            return Optional.empty();
        }
    }

    private MessageDispatchResult reject(MessageKey key, BridgeError reason, DispatchStage stage, Weight unspent,
                                         boolean feePaid, String detail) {
        return report(key, MessageDispatchResult.rejected(reason, stage, unspent, feePaid), detail);
    }

    private MessageDispatchResult report(MessageKey key, MessageDispatchResult result, String detail) {
        if (result.getRejection().isPresent())
            logger.debug("Message {} from {} rejected at stage {}: {} ({})", key, sourceChain, result.getStage(),
                    result.getRejection().get(), detail);
        else
            logger.trace("Message {} from {} dispatched: {}", key, sourceChain, result);
        eventSink.deposit(new MessageDispatchEvent(sourceChain, key, result.getDispatchResult(), result.getUnspentWeight(),
                result.getRejection(), Optional.ofNullable(detail)));
        return result;
    }
}
