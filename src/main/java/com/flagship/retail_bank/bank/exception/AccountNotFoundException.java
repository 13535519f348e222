package com.flagship.retail_bank.bank.exception;

/**
 * Raised by the HTTP layer when a requested account number is unknown.
 */
public class AccountNotFoundException extends RuntimeException {

    private final int accountNumber;

    public AccountNotFoundException(int accountNumber) {
        super("Account not found: " + accountNumber);
        this.accountNumber = accountNumber;
    }

    public int getAccountNumber() {
        return accountNumber;
    }
}
