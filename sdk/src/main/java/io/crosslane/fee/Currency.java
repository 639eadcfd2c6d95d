package io.crosslane.fee;

import io.crosslane.model.AccountId;

import java.math.BigInteger;

/**
 * Balances of the chain the bridge runs on.
 * <p>
 * Part of an account balance may be locked. Locked funds can not be transferred away by the owner, only
 * slashed by the bridge.
 */
public interface Currency {

    BigInteger totalBalance(AccountId account);

    BigInteger lockedBalance(AccountId account);

    // Total balance minus the locked part
    BigInteger freeBalance(AccountId account);

    /**
     * Moves `amount` of the free balance from one account to another. Nothing is moved if the transfer fails.
     */
    void transfer(AccountId from, AccountId to, BigInteger amount) throws InsufficientBalanceException;

    /**
     * Sets the locked part of the balance of `account` to `amount`, replacing any previous lock.
     */
    void setLock(AccountId account, BigInteger amount) throws InsufficientBalanceException;

    void removeLock(AccountId account);

    /**
     * Moves `amount` out of the locked part of `from` to `to`, lowering the lock by the same amount.
     * Nothing is moved if less than `amount` is locked.
     */
    void slashLocked(AccountId from, AccountId to, BigInteger amount) throws InsufficientBalanceException;
}
