package io.crosslane.dispatch;

import io.crosslane.model.AccountId;
import io.crosslane.model.Weight;

/**
 * Dispatches messages received over an inbound lane.
 * <p>
 * Implementations must never throw: any failure of a single message is reported in its
 * {@link MessageDispatchResult} so that the rest of the delivery batch is processed normally.
 * Each call to {@link #dispatch} deposits exactly one terminal dispatch event.
 */
public interface MessageDispatch {

    /**
     * Weight the relayer has to reserve for dispatching the message, as declared by the sender.
     */
    Weight dispatchWeight(DispatchMessage message);

    MessageDispatchResult dispatch(AccountId relayer, DispatchMessage message);
}
