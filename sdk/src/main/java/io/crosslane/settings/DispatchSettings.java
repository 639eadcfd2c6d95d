package io.crosslane.settings;

import io.crosslane.model.Weight;

import java.math.BigInteger;

public final class DispatchSettings {
    private final int specVersion;
    private final BigInteger feePerWeightUnit;
    private final Weight forwardedWeightCredit;

    public DispatchSettings(int specVersion, BigInteger feePerWeightUnit, Weight forwardedWeightCredit) {
        this.specVersion = specVersion;
        this.feePerWeightUnit = feePerWeightUnit;
        this.forwardedWeightCredit = forwardedWeightCredit;
    }

    // Runtime version a message must be built for to be dispatched here
    public int getSpecVersion() {
        return specVersion;
    }

    // Price of a weight unit for calls that pay dispatch at this chain
    public BigInteger getFeePerWeightUnit() {
        return feePerWeightUnit;
    }

    public Weight getForwardedWeightCredit() {
        return forwardedWeightCredit;
    }
}
