package io.crosslane.payload;

import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;

import java.util.Optional;

/**
 * Origin a bridged call is dispatched with on the target chain.
 */
public abstract class CallOrigin {
    public enum Type {
        SOURCE_ROOT((byte) 0),
        TARGET_ACCOUNT((byte) 1),
        SOURCE_ACCOUNT((byte) 2);

        private final byte code;

        Type(byte code) {
            this.code = code;
        }

        public byte code() {
            return code;
        }
    }

    public abstract Type type();

    /**
     * Account the call must be dispatched with, empty if the origin can not be proven.
     */
    public abstract Optional<AccountId> dispatchAccount(MessagePayload payload, ChainId sourceChain, ChainId targetChain);
}
