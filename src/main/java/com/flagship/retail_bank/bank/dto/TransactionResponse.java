package com.flagship.retail_bank.bank.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_bank.bank.Transaction;
import com.flagship.retail_bank.bank.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a single ledger entry.
 */
@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("account_number")
    int accountNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("description")
    String description;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountNumber(transaction.getAccountNumber())
            .amount(transaction.getAmount())
            .type(transaction.getType())
            .timestamp(transaction.getTimestamp())
            .description(transaction.describe())
            .build();
    }
}
