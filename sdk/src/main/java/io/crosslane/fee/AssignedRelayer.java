package io.crosslane.fee;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.model.AccountId;

import java.math.BigInteger;

/**
 * Relayer assigned to a slot of an order. The slot covers blocks `validFrom..=validUntil`.
 */
@JsonView(Views.Default.class)
public final class AssignedRelayer {
    private final AccountId id;
    private final BigInteger fee;
    private final long validFrom;
    private final long validUntil;

    public AssignedRelayer(AccountId id, BigInteger fee, long validFrom, long validUntil) {
        this.id = id;
        this.fee = fee;
        this.validFrom = validFrom;
        this.validUntil = validUntil;
    }

    public AccountId getId() {
        return id;
    }

    public BigInteger getFee() {
        return fee;
    }

    public long getValidFrom() {
        return validFrom;
    }

    public long getValidUntil() {
        return validUntil;
    }

    public boolean covers(long blockNumber) {
        return blockNumber >= validFrom && blockNumber <= validUntil;
    }

    @Override
    public String toString() {
        return "AssignedRelayer{id=" + id + ", fee=" + fee + ", slot=" + validFrom + "..=" + validUntil + "}";
    }
}
