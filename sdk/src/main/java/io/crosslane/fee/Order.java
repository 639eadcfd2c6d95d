package io.crosslane.fee;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;
import io.crosslane.model.MessageKey;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Delivery order of a message: who is expected to deliver it and until when.
 * Created when the message is accepted, consumed when its rewards are paid.
 */
@JsonView(Views.Default.class)
public final class Order {
    private final MessageKey key;
    private final BigInteger fee;
    private final long createdAt;
    private final BigInteger lockedCollateral;
    private final List<AssignedRelayer> assignedRelayers;
    private final Long confirmTime;

    public Order(MessageKey key, BigInteger fee, long createdAt, BigInteger lockedCollateral,
                 List<AssignedRelayer> assignedRelayers, Optional<Long> confirmTime) {
        if (assignedRelayers.isEmpty())
            throw new IllegalArgumentException("Order must have at least one assigned relayer.");
        this.key = key;
        this.fee = fee;
        this.createdAt = createdAt;
        this.lockedCollateral = lockedCollateral;
        this.assignedRelayers = Collections.unmodifiableList(new ArrayList<>(assignedRelayers));
        this.confirmTime = confirmTime.orElse(null);
    }

    public MessageKey getKey() {
        return key;
    }

    public BigInteger getFee() {
        return fee;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    // Collateral each assigned relayer has at stake for this order
    public BigInteger getLockedCollateral() {
        return lockedCollateral;
    }

    public List<AssignedRelayer> getAssignedRelayers() {
        return assignedRelayers;
    }

    public Optional<Long> getConfirmTime() {
        return Optional.ofNullable(confirmTime);
    }

    public Order withConfirmTime(long blockNumber) {
        return new Order(key, fee, createdAt, lockedCollateral, assignedRelayers, Optional.of(blockNumber));
    }

    // Last block of the last slot
    public long deadline() {
        return assignedRelayers.get(assignedRelayers.size() - 1).getValidUntil();
    }

    /**
     * Index of the slot the given block belongs to, empty once all slots have passed.
     */
    public OptionalInt slotAt(long blockNumber) {
        for (int i = 0; i < assignedRelayers.size(); i++) {
            if (assignedRelayers.get(i).covers(blockNumber))
                return OptionalInt.of(i);
        }
        return OptionalInt.empty();
    }

    public long delay(long blockNumber) {
        return Math.max(0, blockNumber - deadline());
    }

    @Override
    public String toString() {
        return "Order{key=" + key + ", fee=" + fee + ", createdAt=" + createdAt + ", lockedCollateral=" + lockedCollateral
                + ", assignedRelayers=" + assignedRelayers + ", confirmTime=" + confirmTime + "}";
    }
}
