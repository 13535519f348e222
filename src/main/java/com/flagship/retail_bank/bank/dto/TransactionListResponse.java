package com.flagship.retail_bank.bank.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_bank.bank.Bank;
import com.flagship.retail_bank.bank.Transaction;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for the ledger listing.
 * Carries a message instead of entries when the ledger is empty.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionListResponse {

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("message")
    String message;

    public static TransactionListResponse from(List<Transaction> transactions) {
        List<TransactionResponse> entries = transactions.stream()
            .map(TransactionResponse::from)
            .toList();
        return new TransactionListResponse(entries, entries.isEmpty() ? Bank.NO_TRANSACTIONS : null);
    }
}
