package io.crosslane.lane;

import io.crosslane.model.Weight;

import java.math.BigInteger;

/**
 * Fee a submitter should offer so that a relayer delivering the message makes a profit.
 */
public class DeliveryFeeEstimator {
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final BigInteger deliveryBaseFee;
    private final BigInteger feePerWeightUnit;
    private final int relayerFeePercent;

    public DeliveryFeeEstimator(BigInteger deliveryBaseFee, BigInteger feePerWeightUnit, int relayerFeePercent) {
        if (relayerFeePercent < 0)
            throw new IllegalArgumentException(String.format("Relayer fee percent `%d` is negative", relayerFeePercent));
        this.deliveryBaseFee = deliveryBaseFee;
        this.feePerWeightUnit = feePerWeightUnit;
        this.relayerFeePercent = relayerFeePercent;
    }

    public BigInteger estimate(Weight dispatchWeight) {
        BigInteger cost = deliveryBaseFee.add(feePerWeightUnit.multiply(BigInteger.valueOf(dispatchWeight.value())));
        return cost.multiply(HUNDRED.add(BigInteger.valueOf(relayerFeePercent))).divide(HUNDRED);
    }
}
