package io.crosslane.fee;

import io.crosslane.errors.BridgeError;
import io.crosslane.errors.BridgeException;
import io.crosslane.model.AccountId;
import io.crosslane.model.DeliveredMessages;
import io.crosslane.model.LaneId;
import io.crosslane.model.MessageKey;
import io.crosslane.settings.FeeMarketSettings;
import io.crosslane.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Orders of outbound messages.
 */
public class FeeMarket {
    private static final Logger logger = LogManager.getLogger();

    static final String NOT_READY = "The fee market is not ready for accepting messages.";
    static final String RELAYER_OCCUPIED = "Relayer `%s` is assigned to an unfinished order";

    private final KeyValueStore<MessageKey, Order> orders;
    private final RelayersRegistry registry;
    private final FeeMarketSettings settings;

    public FeeMarket(KeyValueStore<MessageKey, Order> orders, RelayersRegistry registry, FeeMarketSettings settings) {
        this.orders = orders;
        this.registry = registry;
        this.settings = settings;
    }

    public RelayersRegistry getRegistry() {
        return registry;
    }

    public Optional<BigInteger> marketFee() {
        return registry.marketFee();
    }

    /**
     * Assigns the current cheapest relayers to consecutive slots starting at `now`.
     */
    public Order createOrder(MessageKey key, BigInteger fee, long now) throws BridgeException {
        List<Relayer> relayers = registry.assignedRelayers();
        if (relayers.isEmpty())
            throw new BridgeException(BridgeError.FEE_MARKET_NOT_READY, NOT_READY);
        List<AssignedRelayer> slots = new ArrayList<>(relayers.size());
        long slotStart = now;
        for (Relayer relayer : relayers) {
            long slotEnd = slotStart + settings.getSlotLength() - 1;
            slots.add(new AssignedRelayer(relayer.getId(), relayer.getFee(), slotStart, slotEnd));
            slotStart = slotEnd + 1;
        }
        Order order = new Order(key, fee, now, settings.getCollateralPerOrder(), slots, Optional.empty());
        orders.put(key, order);
        logger.debug("Order created: {}", order);
        return order;
    }

    public Optional<Order> getOrder(MessageKey key) {
        return orders.get(key);
    }

    // Stamps the confirm time of delivered orders that have not been stamped yet
    public void onMessagesDelivered(LaneId laneId, DeliveredMessages messages, long now) {
        for (long nonce = messages.getBegin(); nonce <= messages.getEnd(); nonce++) {
            MessageKey key = new MessageKey(laneId, nonce);
            orders.get(key)
                    .filter(order -> order.getConfirmTime().isEmpty())
                    .ifPresent(order -> orders.put(key, order.withConfirmTime(now)));
        }
    }

    void consumeOrder(MessageKey key) {
        orders.remove(key);
    }

    public boolean isSettled(MessageKey key) {
        return !orders.contains(key);
    }

    public void cancelEnrollment(AccountId who) {
        boolean occupied = orders.values().stream()
                .anyMatch(order -> order.getAssignedRelayers().stream().anyMatch(slot -> slot.getId().equals(who)));
        if (occupied)
            throw new IllegalStateException(String.format(RELAYER_OCCUPIED, who));
        registry.remove(who);
    }
}
