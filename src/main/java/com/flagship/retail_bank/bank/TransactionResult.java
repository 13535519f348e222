package com.flagship.retail_bank.bank;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outcome of {@link Bank#makeTransaction}.
 *
 * On success carries the appended transaction and the account balance after
 * the change. On a policy failure carries the unchanged balance. Not-found and
 * invalid-amount results carry neither.
 */
@Value
public class TransactionResult {
    TransactionOutcome outcome;
    Transaction transaction;
    BigDecimal balance;

    public static TransactionResult success(Transaction transaction, BigDecimal balance) {
        return new TransactionResult(TransactionOutcome.SUCCESS, transaction, balance);
    }

    public static TransactionResult rejected(TransactionOutcome outcome, BigDecimal balance) {
        return new TransactionResult(outcome, null, balance);
    }

    public static TransactionResult of(TransactionOutcome outcome) {
        return new TransactionResult(outcome, null, null);
    }

    public boolean isSuccess() {
        return outcome == TransactionOutcome.SUCCESS;
    }

    public Optional<Transaction> getTransaction() {
        return Optional.ofNullable(transaction);
    }

    public Optional<BigDecimal> getBalance() {
        return Optional.ofNullable(balance);
    }

    public String getMessage() {
        return outcome.message();
    }
}
