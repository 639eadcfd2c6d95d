package io.crosslane.dispatch;

import io.crosslane.model.AccountId;
import io.crosslane.model.Weight;

/**
 * Executor of an embedded cross-consensus protocol. Messages forwarded to it are opaque to the bridge.
 */
public interface ForwardedMessageExecutor {

    /**
     * @param origin      account the forwarded message is executed on behalf of
     * @param message     opaque message
     * @param weightLimit weight the message is allowed to use
     * @param weightCredit weight already paid for outside of the executor
     * @return true if the executor has completed the message
     */
    boolean execute(AccountId origin, byte[] message, Weight weightLimit, Weight weightCredit) throws CallExecutionFailedException;
}
