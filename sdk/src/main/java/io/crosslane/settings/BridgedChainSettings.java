package io.crosslane.settings;

import io.crosslane.model.Weight;

import java.math.BigInteger;

/**
 * Limits of the bridged chain and the prices a relayer pays there for a delivery.
 */
public final class BridgedChainSettings {
    private final String storageNamespace;
    private final int maxExtrinsicSize;
    private final Weight maxExtrinsicWeight;
    private final BigInteger deliveryBaseFee;
    private final BigInteger feePerWeightUnit;
    private final int relayerFeePercent;

    public BridgedChainSettings(String storageNamespace, int maxExtrinsicSize, Weight maxExtrinsicWeight,
                                BigInteger deliveryBaseFee, BigInteger feePerWeightUnit, int relayerFeePercent) {
        if (storageNamespace.isEmpty())
            throw new IllegalArgumentException("Storage namespace of the bridged chain must be defined.");
        if (maxExtrinsicSize <= 0)
            throw new IllegalArgumentException(String.format("Max extrinsic size must be positive, got `%d`", maxExtrinsicSize));
        this.storageNamespace = storageNamespace;
        this.maxExtrinsicSize = maxExtrinsicSize;
        this.maxExtrinsicWeight = maxExtrinsicWeight;
        this.deliveryBaseFee = deliveryBaseFee;
        this.feePerWeightUnit = feePerWeightUnit;
        this.relayerFeePercent = relayerFeePercent;
    }

    // Prefix of the storage keys of the messages module at the bridged chain
    public String getStorageNamespace() {
        return storageNamespace;
    }

    public int getMaxExtrinsicSize() {
        return maxExtrinsicSize;
    }

    public Weight getMaxExtrinsicWeight() {
        return maxExtrinsicWeight;
    }

    public BigInteger getDeliveryBaseFee() {
        return deliveryBaseFee;
    }

    public BigInteger getFeePerWeightUnit() {
        return feePerWeightUnit;
    }

    public int getRelayerFeePercent() {
        return relayerFeePercent;
    }
}
