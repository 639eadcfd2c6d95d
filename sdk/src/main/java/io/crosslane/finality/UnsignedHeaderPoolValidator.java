package io.crosslane.finality;

import io.crosslane.errors.BridgeError;
import io.crosslane.proof.BridgedHeader;
import io.crosslane.utils.Hash;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Decides whether an unsigned submission of a bridged header may enter the transaction pool.
 */
public class UnsignedHeaderPoolValidator {
    private static final Logger logger = LogManager.getLogger();

    private final long maxFutureNumberDifference;

    public UnsignedHeaderPoolValidator(long maxFutureNumberDifference) {
        if (maxFutureNumberDifference < 0)
            throw new IllegalArgumentException(String.format("Max future number difference `%d` is negative", maxFutureNumberDifference));
        this.maxFutureNumberDifference = maxFutureNumberDifference;
    }

    public PoolValidity acceptHeaderIntoPool(BridgedHeader header, HeaderChainView chain) {
        return acceptHeaderIntoPool(header.hash(), header.getNumber(), chain);
    }

    public PoolValidity acceptHeaderIntoPool(Hash headerHash, long number, HeaderChainView chain) {
        if (number <= chain.finalizedNumber()) {
            logger.debug("Header {} #{} is at or below finalized #{}", headerHash, number, chain.finalizedNumber());
            return PoolValidity.invalid(BridgeError.ANCIENT_HEADER);
        }
        if (chain.isKnownHeader(headerHash)) {
            logger.debug("Header {} #{} is already imported", headerHash, number);
            return PoolValidity.invalid(BridgeError.KNOWN_HEADER);
        }
        if (number - chain.bestNumber() > maxFutureNumberDifference) {
            logger.debug("Header {} #{} is too far ahead of best #{}", headerHash, number, chain.bestNumber());
            return PoolValidity.unknown(BridgeError.HEADER_TOO_FAR_IN_FUTURE);
        }
        return PoolValidity.VALID;
    }
}
