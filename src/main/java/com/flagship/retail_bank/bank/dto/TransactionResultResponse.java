package com.flagship.retail_bank.bank.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_bank.bank.TransactionOutcome;
import com.flagship.retail_bank.bank.TransactionResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO for a deposit or withdrawal request.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResultResponse {

    @JsonProperty("outcome")
    TransactionOutcome outcome;

    @JsonProperty("message")
    String message;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    public static TransactionResultResponse from(TransactionResult result) {
        return TransactionResultResponse.builder()
            .outcome(result.getOutcome())
            .message(result.getMessage())
            .balance(result.getBalance().orElse(null))
            .transaction(result.getTransaction().map(TransactionResponse::from).orElse(null))
            .build();
    }
}
