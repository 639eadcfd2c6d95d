package io.crosslane.fee;

import io.crosslane.model.AccountId;
import io.crosslane.settings.FeeMarketSettings;
import io.crosslane.storage.KeyValueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Relayers enrolled in the fee market, with the collateral they have put at stake.
 */
public class RelayersRegistry {
    private static final Logger logger = LogManager.getLogger();

    static final String ALREADY_ENROLLED = "Relayer `%s` is already enrolled";
    static final String NOT_ENROLLED = "Relayer `%s` is not enrolled";
    static final String COLLATERAL_TOO_LOW = "Collateral `%s` is below the collateral of an order `%s`";
    static final String INSUFFICIENT_BALANCE = "Relayer `%s` can not lock collateral `%s`, free balance is `%s`";

    private static final Comparator<Relayer> ASSIGNMENT_ORDER = Comparator
            .comparing(Relayer::getFee)
            .thenComparing(Relayer::getCollateral, Comparator.reverseOrder())
            .thenComparingLong(Relayer::getEnrolmentIndex);

    private final KeyValueStore<AccountId, Relayer> relayers;
    private final Currency currency;
    private final FeeMarketSettings settings;
    private long nextEnrolmentIndex;

    public RelayersRegistry(KeyValueStore<AccountId, Relayer> relayers, Currency currency, FeeMarketSettings settings) {
        this.relayers = relayers;
        this.currency = currency;
        this.settings = settings;
        this.nextEnrolmentIndex = relayers.values().stream().mapToLong(Relayer::getEnrolmentIndex).max().orElse(-1) + 1;
    }

    public void enroll(AccountId who, BigInteger collateral, BigInteger fee) {
        if (relayers.contains(who))
            throw new IllegalArgumentException(String.format(ALREADY_ENROLLED, who));
        if (collateral.compareTo(settings.getCollateralPerOrder()) < 0)
            throw new IllegalArgumentException(String.format(COLLATERAL_TOO_LOW, collateral, settings.getCollateralPerOrder()));
        BigInteger balance = currency.freeBalance(who);
        if (balance.compareTo(collateral) < 0)
            throw new IllegalArgumentException(String.format(INSUFFICIENT_BALANCE, who, collateral, balance));
        try {
            currency.setLock(who, collateral);
        } catch (InsufficientBalanceException e) {
            throw new IllegalArgumentException(String.format(INSUFFICIENT_BALANCE, who, collateral, balance), e);
        }
        relayers.put(who, new Relayer(who, collateral, fee, nextEnrolmentIndex++));
        logger.info("Relayer {} enrolled with collateral {} and fee {}", who, collateral, fee);
    }

    void remove(AccountId who) {
        if (!relayers.contains(who))
            throw new IllegalArgumentException(String.format(NOT_ENROLLED, who));
        relayers.remove(who);
        currency.removeLock(who);
        logger.info("Relayer {} cancelled its enrolment, collateral released", who);
    }

    public Optional<Relayer> getRelayer(AccountId who) {
        return relayers.get(who);
    }

    public BigInteger lockedCollateral(AccountId who) {
        return relayers.get(who).map(Relayer::getCollateral).orElse(BigInteger.ZERO);
    }

    // Records collateral left after a slash; the currency lock was already lowered by the slash itself
    void updateCollateral(AccountId who, BigInteger newCollateral) {
        relayers.get(who).ifPresent(relayer -> relayers.put(who, relayer.withCollateral(newCollateral.max(BigInteger.ZERO))));
    }

    /**
     * Relayers a new order is assigned to: the cheapest ones that still have enough collateral for an order.
     * Empty if there are not enough of them.
     */
    public List<Relayer> assignedRelayers() {
        List<Relayer> candidates = relayers.values().stream()
                .filter(relayer -> relayer.getCollateral().compareTo(settings.getCollateralPerOrder()) >= 0)
                .sorted(ASSIGNMENT_ORDER)
                .limit(settings.getAssignedRelayersNumber())
                .collect(Collectors.toList());
        return candidates.size() < settings.getAssignedRelayersNumber() ? List.of() : candidates;
    }

    // Fee of the last assigned relayer, the lowest fee a message has to pay
    public Optional<BigInteger> marketFee() {
        List<Relayer> assigned = assignedRelayers();
        if (assigned.isEmpty())
            return Optional.empty();
        return Optional.of(assigned.get(assigned.size() - 1).getFee());
    }
}
