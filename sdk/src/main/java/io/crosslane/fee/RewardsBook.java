package io.crosslane.fee;

import io.crosslane.model.AccountId;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sums of the reward items of one batch, per recipient, so that each recipient gets a single transfer.
 */
public final class RewardsBook {
    private final Map<AccountId, BigInteger> messagesRelayersRewards = new TreeMap<>();
    private final Map<AccountId, BigInteger> confirmationRelayersRewards = new TreeMap<>();
    private final Map<AccountId, BigInteger> assignedRelayersRewards = new TreeMap<>();
    private final AccountId treasury;
    private BigInteger treasuryTotalRewards = BigInteger.ZERO;

    public RewardsBook(AccountId treasury) {
        this.treasury = treasury;
    }

    public void add(RewardItem item) {
        item.getToSlotRelayer().ifPresent(payout -> assignedRelayersRewards.merge(payout.getAccount(), payout.getAmount(), BigInteger::add));
        item.getToMessageRelayer().ifPresent(payout -> messagesRelayersRewards.merge(payout.getAccount(), payout.getAmount(), BigInteger::add));
        item.getToConfirmRelayer().ifPresent(payout -> confirmationRelayersRewards.merge(payout.getAccount(), payout.getAmount(), BigInteger::add));
        item.getToTreasury().ifPresent(payout -> treasuryTotalRewards = treasuryTotalRewards.add(payout.getAmount()));
    }

    public Map<AccountId, BigInteger> getMessagesRelayersRewards() {
        return Collections.unmodifiableMap(messagesRelayersRewards);
    }

    public Map<AccountId, BigInteger> getConfirmationRelayersRewards() {
        return Collections.unmodifiableMap(confirmationRelayersRewards);
    }

    public Map<AccountId, BigInteger> getAssignedRelayersRewards() {
        return Collections.unmodifiableMap(assignedRelayersRewards);
    }

    public BigInteger getTreasuryTotalRewards() {
        return treasuryTotalRewards;
    }

    /**
     * Transfers in payment order: message relayers, confirmation relayers, assigned relayers, treasury.
     */
    public List<Payout> payouts() {
        List<Payout> payouts = new ArrayList<>();
        messagesRelayersRewards.forEach((account, amount) -> payouts.add(new Payout(account, amount)));
        confirmationRelayersRewards.forEach((account, amount) -> payouts.add(new Payout(account, amount)));
        assignedRelayersRewards.forEach((account, amount) -> payouts.add(new Payout(account, amount)));
        payouts.add(new Payout(treasury, treasuryTotalRewards));
        return payouts;
    }

    public BigInteger total() {
        return payouts().stream().map(Payout::getAmount).reduce(BigInteger.ZERO, BigInteger::add);
    }
}
