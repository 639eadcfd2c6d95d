package io.crosslane.fee;

import java.math.BigInteger;

// Fixed amount per block of delay, up to the whole locked collateral.
public class LinearSlasher implements Slasher {
    private final BigInteger slashPerBlock;

    public LinearSlasher(BigInteger slashPerBlock) {
        this.slashPerBlock = slashPerBlock;
    }

    @Override
    public BigInteger slashAmount(BigInteger lockedCollateral, long delay) {
        return slashPerBlock.multiply(BigInteger.valueOf(delay)).min(lockedCollateral);
    }
}
