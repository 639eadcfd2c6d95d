package io.crosslane.payload;

import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;

import java.util.Objects;
import java.util.Optional;

// Account of the source chain, dispatched as an account derived from it.
public final class SourceAccountOrigin extends CallOrigin {
    private final AccountId sourceAccount;

    public SourceAccountOrigin(AccountId sourceAccount) {
        this.sourceAccount = Objects.requireNonNull(sourceAccount);
    }

    public AccountId getSourceAccount() {
        return sourceAccount;
    }

    @Override
    public Type type() {
        return Type.SOURCE_ACCOUNT;
    }

    @Override
    public Optional<AccountId> dispatchAccount(MessagePayload payload, ChainId sourceChain, ChainId targetChain) {
        return Optional.of(AccountDerivation.deriveAccount(sourceChain, sourceAccount));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceAccountOrigin)) return false;
        return sourceAccount.equals(((SourceAccountOrigin) o).sourceAccount);
    }

    @Override
    public int hashCode() {
        return sourceAccount.hashCode();
    }

    @Override
    public String toString() {
        return "SourceAccount{" + sourceAccount + "}";
    }
}
