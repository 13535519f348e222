package com.flagship.retail_bank.account;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;

/**
 * Checking account with a fixed overdraft facility.
 *
 * Deposits are credited as-is. Withdrawals may take the balance down to
 * {@code -OVERDRAFT_LIMIT}.
 */
@Slf4j
public class CheckingAccount extends Account {

    public static final BigDecimal OVERDRAFT_LIMIT = new BigDecimal("500");

    public CheckingAccount(int accountNumber, String holderName, BigDecimal initialBalance) {
        super(accountNumber, holderName, initialBalance);
    }

    @Override
    public void deposit(BigDecimal amount) {
        credit(amount);
        log.debug("Deposited {} to checking account {}. New balance: {}",
                amount, getAccountNumber(), getBalance());
    }

    @Override
    public boolean withdraw(BigDecimal amount) {
        if (!super.withdraw(amount)) {
            log.debug("Overdraft limit reached on checking account {}: balance={}, requested={}",
                    getAccountNumber(), getBalance(), amount);
            return false;
        }
        log.debug("Withdrawn {} from checking account {}. New balance: {}",
                amount, getAccountNumber(), getBalance());
        return true;
    }

    @Override
    public BigDecimal getFloor() {
        return AccountType.CHECKING.floor();
    }

    @Override
    public AccountType getType() {
        return AccountType.CHECKING;
    }
}
