package io.crosslane.fee;

import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;
import io.crosslane.events.BridgeEventSink;
import io.crosslane.model.AccountId;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageKey;
import io.crosslane.model.UnrewardedRelayer;
import io.crosslane.payload.RawOrigin;
import io.crosslane.settings.FeeMarketSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Moves fees into the relayer fund when messages are sent and pays relayers when deliveries are confirmed.
 * <p>
 * Slashed collateral is moved to the relayer fund as soon as it is computed and joins the reward pool of
 * the message. Rewards of a batch are summed up per recipient and paid with one transfer each. A failed
 * transfer is logged and never aborts the batch.
 */
public class FeeMarketPayment {
    private static final Logger logger = LogManager.getLogger();

    static final String NO_FEE_PAYER = "Message fee `%s` can not be paid by origin `%s`";
    static final String FEE_NOT_PAID = "Submitter `%s` can not pay message fee `%s`: %s";

    private final Currency currency;
    private final FeeMarket feeMarket;
    private final Slasher slasher;
    private final RewardCalculator calculator;
    private final FeeMarketSettings settings;
    private final BridgeEventSink eventSink;

    public FeeMarketPayment(Currency currency, FeeMarket feeMarket, Slasher slasher, FeeMarketSettings settings,
                            BridgeEventSink eventSink) {
        this.currency = currency;
        this.feeMarket = feeMarket;
        this.slasher = slasher;
        this.calculator = new RewardCalculator(settings);
        this.settings = settings;
        this.eventSink = eventSink;
    }

    public void payDeliveryAndDispatchFee(RawOrigin submitter, BigInteger fee) throws BridgeException {
        if (fee.signum() == 0)
            return;
        Optional<AccountId> payer = submitter.signer();
        if (payer.isEmpty())
            throw new BridgeException(BridgeError.FEE_PAYMENT_FAILED, String.format(NO_FEE_PAYER, fee, submitter));
        try {
            currency.transfer(payer.get(), settings.getRelayerFundAccount(), fee);
        } catch (InsufficientBalanceException e) {
            throw new BridgeException(BridgeError.FEE_PAYMENT_FAILED, String.format(FEE_NOT_PAID, payer.get(), fee, e.getMessage()), e);
        }
    }

    /**
     * Rewards the relayers of all messages of `received` that still have an order, slashing assigned relayers
     * of late messages, and consumes those orders.
     *
     * @param relayers relayer entries of the inbound lane, telling who delivered which messages
     * @param now      current block number, used for orders without a confirm time
     */
    public RewardSettlement payRelayersRewards(LaneId laneId, List<UnrewardedRelayer> relayers, AccountId confirmRelayer,
                                               DeliveredMessages received, long now) {
        RewardsBook book = new RewardsBook(settings.getTreasuryAccount());
        List<RewardItem> items = new ArrayList<>();
        BigInteger totalFees = BigInteger.ZERO;
        BigInteger totalSlashed = BigInteger.ZERO;

        for (UnrewardedRelayer entry : relayers) {
            long begin = Math.max(entry.getMessages().getBegin(), received.getBegin());
            long end = Math.min(entry.getMessages().getEnd(), received.getEnd());
            for (long nonce = begin; nonce <= end; nonce++) {
                MessageKey key = new MessageKey(laneId, nonce);
                Optional<Order> order = feeMarket.getOrder(key);
                if (order.isEmpty()) {
                    logger.debug("Order of message {} is already settled", key);
                    continue;
                }
                long confirmTime = order.get().getConfirmTime().orElse(now);
                OrderSettlement settlement = settleOrder(order.get(), entry.getRelayer(), confirmRelayer, confirmTime);
                RewardItem item = settlement.item;
                totalFees = totalFees.add(order.get().getFee());
                totalSlashed = totalSlashed.add(settlement.slashed);
                book.add(item);
                items.add(item);
                feeMarket.consumeOrder(key);
                eventSink.deposit(new OrderRewardEvent(key, item));
            }
        }

        for (Payout payout : book.payouts()) {
            doReward(payout.getAccount(), payout.getAmount());
        }
        logger.info("Lane {}: rewarded {} messages, fees {}, slashed {}", laneId, items.size(), totalFees, totalSlashed);
        return new RewardSettlement(items, book, totalFees, totalSlashed);
    }

    private static final class OrderSettlement {
        final RewardItem item;
        final BigInteger slashed;

        OrderSettlement(RewardItem item, BigInteger slashed) {
            this.item = item;
            this.slashed = slashed;
        }
    }

    private OrderSettlement settleOrder(Order order, AccountId messageRelayer, AccountId confirmRelayer, long confirmTime) {
        BigInteger slashed = BigInteger.ZERO;
        List<AssignedRelayer> slots = order.getAssignedRelayers();
        OptionalInt slot = order.slotAt(confirmTime);
        if (slot.isPresent()) {
            // assignees of all earlier slots missed their chance
            for (int i = 0; i < slot.getAsInt(); i++) {
                slashed = slashed.add(slashAssignedRelayer(order, slots.get(i).getId(), calculator.slotMissSlash(order), confirmTime));
            }
            AccountId slotRelayer = slots.get(slot.getAsInt()).getId();
            RewardItem item = calculator.rewardsInSlot(order.getFee().add(slashed), calculator.baseFee(order.getFee()),
                    slotRelayer, messageRelayer, confirmRelayer);
            return new OrderSettlement(item, slashed);
        }

        BigInteger amount = calculator.lateDeliverySlash(slasher, order, order.delay(confirmTime));
        for (AssignedRelayer assigned : slots) {
            slashed = slashed.add(slashAssignedRelayer(order, assigned.getId(), amount, confirmTime));
        }
        RewardItem item = calculator.rewardsAfterDeadline(order.getFee().add(slashed), messageRelayer, confirmRelayer);
        return new OrderSettlement(item, slashed);
    }

    /**
     * @return amount actually moved to the relayer fund
     */
    BigInteger slashAssignedRelayer(Order order, AccountId who, BigInteger amount, long confirmTime) {
        RelayersRegistry registry = feeMarket.getRegistry();
        BigInteger collateral = registry.lockedCollateral(who);
        BigInteger toSlash = amount.min(collateral);
        if (toSlash.signum() <= 0)
            return BigInteger.ZERO;
        BigInteger moved;
        try {
            currency.slashLocked(who, settings.getRelayerFundAccount(), toSlash);
            registry.updateCollateral(who, collateral.subtract(toSlash));
            moved = toSlash;
        } catch (InsufficientBalanceException e) {
            logger.error("Slash of relayer {} for message {} failed, {} ({}): {}",
                    who, order.getKey(), toSlash, BridgeError.SLASH_TRANSFER_FAILED, e.getMessage());
            moved = BigInteger.ZERO;
        }
        eventSink.deposit(new SlashReport(order.getKey(), order.getCreatedAt(), confirmTime, order.delay(confirmTime), who, moved));
        return moved;
    }

    private void doReward(AccountId to, BigInteger amount) {
        if (amount.signum() == 0)
            return;
        try {
            currency.transfer(settings.getRelayerFundAccount(), to, amount);
            logger.trace("Rewarded {} with {}", to, amount);
        } catch (InsufficientBalanceException e) {
            logger.error("Reward of {} to {} failed: {}", amount, to, e.getMessage());
        }
    }
}
