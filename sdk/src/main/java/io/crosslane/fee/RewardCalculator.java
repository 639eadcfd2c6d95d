package io.crosslane.fee;

import io.crosslane.model.AccountId;
import io.crosslane.settings.FeeMarketSettings;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Splits the reward pool of one message. The parts of an item always sum up to the pool.
 */
public final class RewardCalculator {
    private final FeeMarketSettings settings;

    public RewardCalculator(FeeMarketSettings settings) {
        this.settings = settings;
    }

    public BigInteger baseFee(BigInteger messageFee) {
        return settings.getBaseFeeRatio().mulFloor(messageFee);
    }

    /**
     * Delivery within a slot: everything above the base fee goes to the treasury, the slot relayer gets its share
     * of the base fee and the rest of the base fee is split between message and confirmation relayers.
     */
    public RewardItem rewardsInSlot(BigInteger pool, BigInteger baseFee, AccountId slotRelayer,
                                    AccountId messageRelayer, AccountId confirmRelayer) {
        BigInteger cappedBaseFee = baseFee.min(pool);
        BigInteger toTreasury = pool.subtract(cappedBaseFee);
        BigInteger toSlotRelayer = settings.getAssignedRelayersRewardRatio().mulFloor(cappedBaseFee);
        BigInteger bridgerRewards = cappedBaseFee.subtract(toSlotRelayer);
        BigInteger toMessageRelayer = settings.getMessageRelayersRewardRatio().mulFloor(bridgerRewards);
        BigInteger toConfirmRelayer = bridgerRewards.subtract(toMessageRelayer);
        return new RewardItem(
                Optional.of(new Payout(slotRelayer, toSlotRelayer)),
                Optional.of(new Payout(settings.getTreasuryAccount(), toTreasury)),
                Optional.of(new Payout(messageRelayer, toMessageRelayer)),
                Optional.of(new Payout(confirmRelayer, toConfirmRelayer)));
    }

    /**
     * Delivery after all slots have passed: the whole pool is split between message and confirmation relayers.
     */
    public RewardItem rewardsAfterDeadline(BigInteger pool, AccountId messageRelayer, AccountId confirmRelayer) {
        BigInteger toMessageRelayer = settings.getMessageRelayersRewardRatio().mulFloor(pool);
        return new RewardItem(
                Optional.empty(),
                Optional.empty(),
                Optional.of(new Payout(messageRelayer, toMessageRelayer)),
                Optional.of(new Payout(confirmRelayer, pool.subtract(toMessageRelayer))));
    }

    // Slash of an assignee that missed its slot while a later assignee delivered
    public BigInteger slotMissSlash(Order order) {
        return settings.getAssignedRelayerSlashRatio().mulFloor(order.getLockedCollateral());
    }

    // Slash of an assignee when nobody delivered in time, capped per relayer by the slash protection
    public BigInteger lateDeliverySlash(Slasher slasher, Order order, long delay) {
        BigInteger amount = slasher.slashAmount(order.getLockedCollateral(), delay);
        return settings.getSlashProtect().map(amount::min).orElse(amount);
    }
}
