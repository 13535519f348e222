package com.flagship.retail_bank.account;

import java.math.BigDecimal;

/**
 * The account variants offered by the bank.
 *
 * Each variant owns its own deposit bonus and withdrawal floor;
 * {@link #open(int, String, BigDecimal)} selects the matching implementation.
 */
public enum AccountType {
    /**
     * Pays a fixed 3% bonus on every deposit.
     * Balance may never go below zero.
     */
    SAVINGS,

    /**
     * No deposit bonus.
     * Balance may be overdrawn down to -500.
     */
    CHECKING;

    /**
     * Opens a new account of this type.
     *
     * @param accountNumber Unique account number
     * @param holderName Account holder display name
     * @param initialBalance Opening balance (null is treated as zero)
     * @return New account of the matching variant
     */
    public Account open(int accountNumber, String holderName, BigDecimal initialBalance) {
        return switch (this) {
            case SAVINGS -> new SavingsAccount(accountNumber, holderName, initialBalance);
            case CHECKING -> new CheckingAccount(accountNumber, holderName, initialBalance);
        };
    }

    /**
     * Lowest balance an account of this type may hold, at opening or after a withdrawal.
     */
    public BigDecimal floor() {
        return switch (this) {
            case SAVINGS -> BigDecimal.ZERO;
            case CHECKING -> CheckingAccount.OVERDRAFT_LIMIT.negate();
        };
    }

    /**
     * Human readable label used in log lines and transaction listings.
     */
    public String label() {
        return switch (this) {
            case SAVINGS -> "Savings";
            case CHECKING -> "Checking";
        };
    }
}
