package io.crosslane.settings;

import io.crosslane.model.AccountId;
import io.crosslane.model.Ratio;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

public final class FeeMarketSettings {
    private final int assignedRelayersNumber;
    private final long slotLength;
    private final BigInteger collateralPerOrder;
    private final Ratio baseFeeRatio;
    private final Ratio assignedRelayersRewardRatio;
    private final Ratio messageRelayersRewardRatio;
    private final Ratio confirmRelayersRewardRatio;
    private final Ratio assignedRelayerSlashRatio;
    private final BigInteger slashPerBlock;
    private final BigInteger slashProtect;
    private final AccountId treasuryAccount;
    private final AccountId relayerFundAccount;

    public FeeMarketSettings(int assignedRelayersNumber, long slotLength, BigInteger collateralPerOrder,
                             Ratio baseFeeRatio, Ratio assignedRelayersRewardRatio,
                             Ratio messageRelayersRewardRatio, Ratio confirmRelayersRewardRatio,
                             Ratio assignedRelayerSlashRatio, BigInteger slashPerBlock,
                             Optional<BigInteger> slashProtect,
                             AccountId treasuryAccount, AccountId relayerFundAccount) {
        if (assignedRelayersNumber <= 0)
            throw new IllegalArgumentException(String.format("Assigned relayers number must be positive, got `%d`", assignedRelayersNumber));
        if (slotLength <= 0)
            throw new IllegalArgumentException(String.format("Slot length must be positive, got `%d`", slotLength));
        if (messageRelayersRewardRatio.parts() + confirmRelayersRewardRatio.parts() != Ratio.ACCURACY)
            throw new IllegalArgumentException("Message and confirm relayers reward ratios must sum up to 100%");
        this.assignedRelayersNumber = assignedRelayersNumber;
        this.slotLength = slotLength;
        this.collateralPerOrder = Objects.requireNonNull(collateralPerOrder);
        this.baseFeeRatio = Objects.requireNonNull(baseFeeRatio);
        this.assignedRelayersRewardRatio = Objects.requireNonNull(assignedRelayersRewardRatio);
        this.messageRelayersRewardRatio = messageRelayersRewardRatio;
        this.confirmRelayersRewardRatio = confirmRelayersRewardRatio;
        this.assignedRelayerSlashRatio = Objects.requireNonNull(assignedRelayerSlashRatio);
        this.slashPerBlock = Objects.requireNonNull(slashPerBlock);
        this.slashProtect = slashProtect.orElse(null);
        this.treasuryAccount = Objects.requireNonNull(treasuryAccount);
        this.relayerFundAccount = Objects.requireNonNull(relayerFundAccount);
    }

    public int getAssignedRelayersNumber() {
        return assignedRelayersNumber;
    }

    // Number of blocks each assigned relayer has to deliver a message in
    public long getSlotLength() {
        return slotLength;
    }

    public BigInteger getCollateralPerOrder() {
        return collateralPerOrder;
    }

    public Ratio getBaseFeeRatio() {
        return baseFeeRatio;
    }

    public Ratio getAssignedRelayersRewardRatio() {
        return assignedRelayersRewardRatio;
    }

    public Ratio getMessageRelayersRewardRatio() {
        return messageRelayersRewardRatio;
    }

    public Ratio getConfirmRelayersRewardRatio() {
        return confirmRelayersRewardRatio;
    }

    public Ratio getAssignedRelayerSlashRatio() {
        return assignedRelayerSlashRatio;
    }

    public BigInteger getSlashPerBlock() {
        return slashPerBlock;
    }

    // Ceiling of the amount a single relayer can be slashed for a single late message
    public Optional<BigInteger> getSlashProtect() {
        return Optional.ofNullable(slashProtect);
    }

    public AccountId getTreasuryAccount() {
        return treasuryAccount;
    }

    public AccountId getRelayerFundAccount() {
        return relayerFundAccount;
    }
}
