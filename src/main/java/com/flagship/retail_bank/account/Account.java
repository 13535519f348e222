package com.flagship.retail_bank.account;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Base type for a bank account.
 *
 * Identity (number and holder) is fixed at creation. The balance is only
 * changed through {@link #deposit(BigDecimal)} and {@link #withdraw(BigDecimal)},
 * whose rules are supplied by the concrete variant.
 *
 * Accounts are not thread-safe on their own; the owning Bank serializes access.
 */
@Getter
public abstract class Account {

    private final int accountNumber;
    private final String holderName;
    private BigDecimal balance;

    protected Account(int accountNumber, String holderName, BigDecimal initialBalance) {
        this.accountNumber = accountNumber;
        this.holderName = Objects.requireNonNull(holderName, "Holder name is required");
        this.balance = initialBalance != null ? initialBalance : BigDecimal.ZERO;
    }

    /**
     * Credits the account according to the variant's deposit rule.
     * Deposits never fail at the account level.
     */
    public abstract void deposit(BigDecimal amount);

    /**
     * Attempts to debit the account.
     *
     * @return true if the balance was reduced, false if the withdrawal would
     *         take the balance below {@link #getFloor()} (balance is unchanged)
     */
    public boolean withdraw(BigDecimal amount) {
        if (!canWithdraw(amount)) {
            return false;
        }
        balance = balance.subtract(amount);
        return true;
    }

    /**
     * Checks whether a withdrawal of the given amount would keep the balance
     * at or above the floor. No side effects.
     */
    public boolean canWithdraw(BigDecimal amount) {
        return balance.subtract(amount).compareTo(getFloor()) >= 0;
    }

    /**
     * Lowest balance the account may hold.
     */
    public abstract BigDecimal getFloor();

    public abstract AccountType getType();

    /**
     * True when the current balance is at or above the floor.
     */
    public boolean isWithinFloor() {
        return balance.compareTo(getFloor()) >= 0;
    }

    protected void credit(BigDecimal amount) {
        balance = balance.add(amount);
    }

    @Override
    public String toString() {
        return String.format("%s account %d (%s): balance %s",
            getType().label(), accountNumber, holderName, balance);
    }
}
