package io.crosslane.fee;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.model.AccountId;

import java.math.BigInteger;
import java.util.Objects;

@JsonView(Views.Default.class)
public final class Payout {
    private final AccountId account;
    private final BigInteger amount;

    public Payout(AccountId account, BigInteger amount) {
        this.account = Objects.requireNonNull(account);
        this.amount = Objects.requireNonNull(amount);
    }

    public AccountId getAccount() {
        return account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Payout)) return false;
        Payout that = (Payout) o;
        return account.equals(that.account) && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(account, amount);
    }

    @Override
    public String toString() {
        return account + ":" + amount;
    }
}
