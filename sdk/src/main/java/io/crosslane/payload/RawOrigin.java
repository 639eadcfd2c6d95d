package io.crosslane.payload;

import io.crosslane.model.AccountId;

import java.util.Objects;
import java.util.Optional;

/**
 * Origin of a call on the chain the ledger runs on.
 */
public final class RawOrigin {
    public enum Kind { ROOT, SIGNED, NONE }

    private static final RawOrigin ROOT = new RawOrigin(Kind.ROOT, null);
    private static final RawOrigin NONE = new RawOrigin(Kind.NONE, null);

    private final Kind kind;
    private final AccountId account;

    private RawOrigin(Kind kind, AccountId account) {
        this.kind = kind;
        this.account = account;
    }

    public static RawOrigin root() {
        return ROOT;
    }

    public static RawOrigin none() {
        return NONE;
    }

    public static RawOrigin signed(AccountId account) {
        return new RawOrigin(Kind.SIGNED, Objects.requireNonNull(account));
    }

    public Kind kind() {
        return kind;
    }

    public Optional<AccountId> signer() {
        return Optional.ofNullable(account);
    }

    public boolean isRoot() {
        return kind == Kind.ROOT;
    }

    public boolean isSignedBy(AccountId id) {
        return kind == Kind.SIGNED && account.equals(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawOrigin)) return false;
        RawOrigin that = (RawOrigin) o;
        return kind == that.kind && Objects.equals(account, that.account);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, account);
    }

    @Override
    public String toString() {
        return kind == Kind.SIGNED ? "RawOrigin{signed=" + account + "}" : "RawOrigin{" + kind + "}";
    }
}
