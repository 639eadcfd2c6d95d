package io.crosslane.fee;

import io.crosslane.model.AccountId;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryCurrency implements Currency {
    private final Map<AccountId, BigInteger> balances = new HashMap<>();
    private final Map<AccountId, BigInteger> locks = new HashMap<>();

    private static void checkNotNegative(String what, BigInteger amount) {
        if (amount.signum() < 0)
            throw new IllegalArgumentException(String.format("%s can not be negative: `%s`", what, amount));
    }

    public void deposit(AccountId account, BigInteger amount) {
        checkNotNegative("Deposit", amount);
        balances.merge(account, amount, BigInteger::add);
    }

    @Override
    public BigInteger totalBalance(AccountId account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public BigInteger lockedBalance(AccountId account) {
        return locks.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public BigInteger freeBalance(AccountId account) {
        return totalBalance(account).subtract(lockedBalance(account));
    }

    @Override
    public void transfer(AccountId from, AccountId to, BigInteger amount) throws InsufficientBalanceException {
        checkNotNegative("Transfer amount", amount);
        BigInteger free = freeBalance(from);
        if (free.compareTo(amount) < 0)
            throw new InsufficientBalanceException(String.format("Account %s has %s free, needs %s", from, free, amount));
        move(from, to, amount);
    }

    @Override
    public void setLock(AccountId account, BigInteger amount) throws InsufficientBalanceException {
        checkNotNegative("Lock", amount);
        BigInteger total = totalBalance(account);
        if (total.compareTo(amount) < 0)
            throw new InsufficientBalanceException(String.format("Account %s has %s, can not lock %s", account, total, amount));
        setLockUnchecked(account, amount);
    }

    @Override
    public void removeLock(AccountId account) {
        locks.remove(account);
    }

    @Override
    public void slashLocked(AccountId from, AccountId to, BigInteger amount) throws InsufficientBalanceException {
        checkNotNegative("Slash amount", amount);
        BigInteger locked = lockedBalance(from);
        if (locked.compareTo(amount) < 0)
            throw new InsufficientBalanceException(String.format("Account %s has %s locked, can not slash %s", from, locked, amount));
        move(from, to, amount);
        setLockUnchecked(from, locked.subtract(amount));
    }

    private void setLockUnchecked(AccountId account, BigInteger amount) {
        if (amount.signum() == 0)
            locks.remove(account);
        else
            locks.put(account, amount);
    }

    private void move(AccountId from, AccountId to, BigInteger amount) {
        balances.put(from, totalBalance(from).subtract(amount));
        balances.merge(to, amount, BigInteger::add);
    }
}
