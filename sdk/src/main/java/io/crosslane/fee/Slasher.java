package io.crosslane.fee;

import java.math.BigInteger;

/**
 * Penalty of an assigned relayer for a message delivered after all slots have passed.
 */
public interface Slasher {

    BigInteger slashAmount(BigInteger lockedCollateral, long delay);
}
