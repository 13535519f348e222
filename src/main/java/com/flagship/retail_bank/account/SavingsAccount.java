package com.flagship.retail_bank.account;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Savings account.
 *
 * Every deposit earns a one-time 3% bonus on the deposited amount.
 * Withdrawals may not take the balance below zero.
 */
@Slf4j
public class SavingsAccount extends Account {

    public static final BigDecimal INTEREST_RATE = new BigDecimal("0.03");

    public SavingsAccount(int accountNumber, String holderName, BigDecimal initialBalance) {
        super(accountNumber, holderName, initialBalance);
    }

    /**
     * Interest credited for a deposit of the given amount.
     */
    public BigDecimal interestFor(BigDecimal amount) {
        return amount.multiply(INTEREST_RATE);
    }

    @Override
    public void deposit(BigDecimal amount) {
        BigDecimal interest = interestFor(amount);
        credit(amount.add(interest));
        log.debug("Deposited {} with interest {} to savings account {}. New balance: {}",
                amount, interest, getAccountNumber(), getBalance());
    }

    @Override
    public boolean withdraw(BigDecimal amount) {
        if (!super.withdraw(amount)) {
            log.debug("Insufficient funds on savings account {}: balance={}, requested={}",
                    getAccountNumber(), getBalance(), amount);
            return false;
        }
        log.debug("Withdrawn {} from savings account {}. New balance: {}",
                amount, getAccountNumber(), getBalance());
        return true;
    }

    @Override
    public BigDecimal getFloor() {
        return AccountType.SAVINGS.floor();
    }

    @Override
    public AccountType getType() {
        return AccountType.SAVINGS;
    }
}
