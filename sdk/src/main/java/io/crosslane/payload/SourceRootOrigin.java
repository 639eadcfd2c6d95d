package io.crosslane.payload;

import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;

import java.util.Optional;

// Root of the source chain, dispatched as the derived root account of that chain.
public final class SourceRootOrigin extends CallOrigin {
    public static final SourceRootOrigin INSTANCE = new SourceRootOrigin();

    private SourceRootOrigin() {}

    @Override
    public Type type() {
        return Type.SOURCE_ROOT;
    }

    @Override
    public Optional<AccountId> dispatchAccount(MessagePayload payload, ChainId sourceChain, ChainId targetChain) {
        return Optional.of(AccountDerivation.deriveRootAccount(sourceChain));
    }

    @Override
    public String toString() {
        return "SourceRoot";
    }
}
