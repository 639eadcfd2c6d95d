package io.crosslane.dispatch;

import io.crosslane.model.AccountId;

/**
 * Policy deciding whether a decoded call may be dispatched with a given origin.
 */
public interface CallValidator<C> {

    void validate(AccountId relayer, AccountId origin, C call) throws CallValidationException;

    static <C> CallValidator<C> acceptAll() {
        return (relayer, origin, call) -> { };
    }
}
