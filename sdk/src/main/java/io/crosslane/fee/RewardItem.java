package io.crosslane.fee;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;

import java.math.BigInteger;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Distribution of the fee of a single message, slashed collateral included.
 */
@JsonView(Views.Default.class)
public final class RewardItem {
    private final Payout toSlotRelayer;
    private final Payout toTreasury;
    private final Payout toMessageRelayer;
    private final Payout toConfirmRelayer;

    public RewardItem(Optional<Payout> toSlotRelayer, Optional<Payout> toTreasury,
                      Optional<Payout> toMessageRelayer, Optional<Payout> toConfirmRelayer) {
        this.toSlotRelayer = toSlotRelayer.orElse(null);
        this.toTreasury = toTreasury.orElse(null);
        this.toMessageRelayer = toMessageRelayer.orElse(null);
        this.toConfirmRelayer = toConfirmRelayer.orElse(null);
    }

    public Optional<Payout> getToSlotRelayer() {
        return Optional.ofNullable(toSlotRelayer);
    }

    public Optional<Payout> getToTreasury() {
        return Optional.ofNullable(toTreasury);
    }

    public Optional<Payout> getToMessageRelayer() {
        return Optional.ofNullable(toMessageRelayer);
    }

    public Optional<Payout> getToConfirmRelayer() {
        return Optional.ofNullable(toConfirmRelayer);
    }

    public BigInteger total() {
        return Stream.of(toSlotRelayer, toTreasury, toMessageRelayer, toConfirmRelayer)
                .filter(payout -> payout != null)
                .map(Payout::getAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    @Override
    public String toString() {
        return "RewardItem{toSlotRelayer=" + toSlotRelayer + ", toTreasury=" + toTreasury
                + ", toMessageRelayer=" + toMessageRelayer + ", toConfirmRelayer=" + toConfirmRelayer + "}";
    }
}
