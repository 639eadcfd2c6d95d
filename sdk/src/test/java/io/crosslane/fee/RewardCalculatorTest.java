package io.crosslane.fee;

import io.crosslane.fixtures.TestSettings;
import io.crosslane.model.AccountId;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageKey;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class RewardCalculatorTest {
    private static final AccountId SLOT_RELAYER = new AccountId("0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a0a");
    private static final AccountId MESSAGE_RELAYER = new AccountId("0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b");
    private static final AccountId CONFIRM_RELAYER = new AccountId("0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c0c");

    private static BigInteger amount(Optional<Payout> payout) {
        return payout.orElseThrow().getAmount();
    }

    private static Order order(BigInteger fee) {
        return new Order(new MessageKey(LaneId.fromName("roli"), 1), fee, 100, BigInteger.valueOf(100),
                List.of(new AssignedRelayer(SLOT_RELAYER, BigInteger.TEN, 100, 109)), Optional.empty());
    }

    @Test
    public void whenDeliveredInFirstSlot_feeIsSplitBetweenSlotRelayerTreasuryAndRelayers() {
        // Arrange
        RewardCalculator calculator = new RewardCalculator(TestSettings.feeMarket());
        BigInteger fee = BigInteger.valueOf(100);

        // Act
        BigInteger baseFee = calculator.baseFee(fee);
        RewardItem item = calculator.rewardsInSlot(fee, baseFee, SLOT_RELAYER, MESSAGE_RELAYER, CONFIRM_RELAYER);

        // Assert
        assertEquals(BigInteger.valueOf(40), baseFee);
        assertEquals(BigInteger.valueOf(20), amount(item.getToSlotRelayer()));
        assertEquals(BigInteger.valueOf(60), amount(item.getToTreasury()));
        assertEquals(BigInteger.valueOf(16), amount(item.getToMessageRelayer()));
        assertEquals(BigInteger.valueOf(4), amount(item.getToConfirmRelayer()));
        assertEquals(fee, item.total());
    }

    @Test
    public void whenSplitDoesNotDivideEvenly_confirmRelayerGetsTheRemainder() {
        // Arrange
        RewardCalculator calculator = new RewardCalculator(TestSettings.feeMarket());
        BigInteger fee = BigInteger.valueOf(33);

        // Act
        RewardItem item = calculator.rewardsInSlot(fee, calculator.baseFee(fee), SLOT_RELAYER, MESSAGE_RELAYER, CONFIRM_RELAYER);

        // Assert
        // base fee 13, slot relayer 6, message relayer 80% of 7
        assertEquals(BigInteger.valueOf(6), amount(item.getToSlotRelayer()));
        assertEquals(BigInteger.valueOf(20), amount(item.getToTreasury()));
        assertEquals(BigInteger.valueOf(5), amount(item.getToMessageRelayer()));
        assertEquals(BigInteger.valueOf(2), amount(item.getToConfirmRelayer()));
        assertEquals(fee, item.total());
    }

    @Test
    public void whenDeliveredAfterDeadline_wholePoolGoesToRelayers() {
        // Arrange
        RewardCalculator calculator = new RewardCalculator(TestSettings.feeMarket());

        // Act
        RewardItem item = calculator.rewardsAfterDeadline(BigInteger.valueOf(115), MESSAGE_RELAYER, CONFIRM_RELAYER);

        // Assert
        assertTrue(item.getToSlotRelayer().isEmpty());
        assertTrue(item.getToTreasury().isEmpty());
        assertEquals(BigInteger.valueOf(92), amount(item.getToMessageRelayer()));
        assertEquals(BigInteger.valueOf(23), amount(item.getToConfirmRelayer()));
    }

    @Test
    public void whenSlashProtectionIsSet_lateDeliverySlashIsCapped() {
        // Arrange
        Order order = order(BigInteger.valueOf(100));
        RewardCalculator unprotected = new RewardCalculator(TestSettings.feeMarket());
        RewardCalculator protectedCalculator = new RewardCalculator(TestSettings.feeMarket(Optional.of(BigInteger.valueOf(5))));
        Slasher slasher = new LinearSlasher(BigInteger.TWO);

        // Act & Assert
        assertEquals(BigInteger.valueOf(12), unprotected.lateDeliverySlash(slasher, order, 6));
        assertEquals(BigInteger.valueOf(100), unprotected.lateDeliverySlash(slasher, order, 1000));
        assertEquals(BigInteger.valueOf(5), protectedCalculator.lateDeliverySlash(slasher, order, 6));
        assertEquals(BigInteger.valueOf(2), protectedCalculator.lateDeliverySlash(slasher, order, 1));
    }

    @Test
    public void whenSlotIsMissed_slashIsShareOfOrderCollateral() {
        // Arrange
        RewardCalculator calculator = new RewardCalculator(TestSettings.feeMarket());

        // Act
        BigInteger slash = calculator.slotMissSlash(order(BigInteger.valueOf(100)));

        // Assert
        assertEquals(BigInteger.valueOf(20), slash);
    }
}
