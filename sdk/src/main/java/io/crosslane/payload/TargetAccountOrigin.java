package io.crosslane.payload;

import io.crosslane.model.AccountId;
import io.crosslane.model.ChainId;
import io.crosslane.utils.Ed25519;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Account of the target chain that authorized the source account to dispatch calls on its behalf.
 * The authorization is an Ed25519 signature over the ownership digest, made with the target account key.
 */
public final class TargetAccountOrigin extends CallOrigin {
    private final AccountId sourceAccount;
    private final AccountId targetAccount;
    private final byte[] signature;

    public TargetAccountOrigin(AccountId sourceAccount, AccountId targetAccount, byte[] signature) {
        this.sourceAccount = Objects.requireNonNull(sourceAccount);
        this.targetAccount = Objects.requireNonNull(targetAccount);
        this.signature = Objects.requireNonNull(signature);
    }

    public AccountId getSourceAccount() {
        return sourceAccount;
    }

    public AccountId getTargetAccount() {
        return targetAccount;
    }

    public byte[] getSignature() {
        return Arrays.copyOf(signature, signature.length);
    }

    @Override
    public Type type() {
        return Type.TARGET_ACCOUNT;
    }

    @Override
    public Optional<AccountId> dispatchAccount(MessagePayload payload, ChainId sourceChain, ChainId targetChain) {
        byte[] digest = AccountDerivation.ownershipDigest(
                payload.getCall(), sourceAccount, payload.getSpecVersion(), sourceChain, targetChain);
        if (!Ed25519.verify(signature, digest, targetAccount.toBytes()))
            return Optional.empty();
        return Optional.of(targetAccount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TargetAccountOrigin)) return false;
        TargetAccountOrigin that = (TargetAccountOrigin) o;
        return sourceAccount.equals(that.sourceAccount)
                && targetAccount.equals(that.targetAccount)
                && Arrays.equals(signature, that.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceAccount, targetAccount) * 31 + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        return "TargetAccount{source=" + sourceAccount + ", target=" + targetAccount + "}";
    }
}
