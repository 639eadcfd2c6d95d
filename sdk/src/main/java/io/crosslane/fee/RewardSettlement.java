package io.crosslane.fee;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of paying the relayers of a confirmed batch.
 */
public final class RewardSettlement {
    private final List<RewardItem> items;
    private final RewardsBook book;
    private final BigInteger totalFees;
    private final BigInteger totalSlashed;

    public RewardSettlement(List<RewardItem> items, RewardsBook book, BigInteger totalFees, BigInteger totalSlashed) {
        this.items = Collections.unmodifiableList(items);
        this.book = book;
        this.totalFees = totalFees;
        this.totalSlashed = totalSlashed;
    }

    public List<RewardItem> getItems() {
        return items;
    }

    public RewardsBook getBook() {
        return book;
    }

    // Fees of the settled orders
    public BigInteger getTotalFees() {
        return totalFees;
    }

    // Collateral actually moved to the relayer fund
    public BigInteger getTotalSlashed() {
        return totalSlashed;
    }
}
