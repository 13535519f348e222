package com.flagship.retail_bank.bank;

/**
 * Result code of a transaction request.
 *
 * Only {@link #SUCCESS} produces a ledger entry.
 */
public enum TransactionOutcome {
    SUCCESS("Transaction successful"),

    /**
     * No account with the requested number exists.
     */
    ACCOUNT_NOT_FOUND("Account not found"),

    /**
     * Savings withdrawal would take the balance below zero.
     */
    INSUFFICIENT_FUNDS("Insufficient funds"),

    /**
     * Checking withdrawal would exceed the overdraft limit.
     */
    OVERDRAFT_LIMIT_REACHED("Overdraft limit reached"),

    /**
     * Amount was missing, zero or negative.
     */
    INVALID_AMOUNT("Amount must be positive");

    private final String message;

    TransactionOutcome(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
