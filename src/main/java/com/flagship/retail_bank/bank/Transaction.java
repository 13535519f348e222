package com.flagship.retail_bank.bank;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A completed ledger event.
 *
 * Created by the Bank only after the balance change it records has been
 * applied. Immutable once created.
 */
@Value
public class Transaction {
    long id;
    int accountNumber;
    BigDecimal amount;
    TransactionType type;
    Instant timestamp;

    public static Transaction record(long id, int accountNumber, BigDecimal amount, TransactionType type) {
        return new Transaction(id, accountNumber, amount, type, Instant.now());
    }

    /**
     * Display form used by ledger listings.
     */
    public String describe() {
        return String.format("Transaction %d: %s of %s on %s", id, type.label(), amount, timestamp);
    }
}
