package io.crosslane.fee;

import io.crosslane.model.AccountId;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Enrolled relayer: collateral it has locked and the fee it asks for delivering a message.
 */
public final class Relayer {
    private final AccountId id;
    private final BigInteger collateral;
    private final BigInteger fee;
    private final long enrolmentIndex;

    public Relayer(AccountId id, BigInteger collateral, BigInteger fee, long enrolmentIndex) {
        this.id = Objects.requireNonNull(id);
        this.collateral = Objects.requireNonNull(collateral);
        this.fee = Objects.requireNonNull(fee);
        this.enrolmentIndex = enrolmentIndex;
    }

    public AccountId getId() {
        return id;
    }

    public BigInteger getCollateral() {
        return collateral;
    }

    public BigInteger getFee() {
        return fee;
    }

    public long getEnrolmentIndex() {
        return enrolmentIndex;
    }

    public Relayer withCollateral(BigInteger newCollateral) {
        return new Relayer(id, newCollateral, fee, enrolmentIndex);
    }

    @Override
    public String toString() {
        return "Relayer{id=" + id + ", collateral=" + collateral + ", fee=" + fee + "}";
    }
}
