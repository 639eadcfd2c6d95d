package io.crosslane.dispatch;

import io.crosslane.model.AccountId;
import io.crosslane.model.Weight;

import java.util.Optional;

/**
 * Call set of the chain the bridge runs on. Bridged calls are decoded, weighed and executed through it.
 *
 * @param <C> decoded call type
 */
public interface CallDispatcher<C> {

    C decode(byte[] encodedCall) throws CallDecodeException;

    /**
     * Weight the call needs at least. A message declaring less is not dispatched.
     */
    Weight minimalWeight(C call);

    /**
     * Executes the call with a signed origin.
     *
     * @return weight actually consumed, if the call reports it
     * @throws CallExecutionFailedException if the call fails
     */
    Optional<Weight> execute(AccountId origin, C call) throws CallExecutionFailedException;
}
