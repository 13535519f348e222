package com.flagship.retail_bank.bank.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_bank.account.AccountType;
import com.flagship.retail_bank.bank.AccountSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Response DTO describing an account and its current balance.
 */
@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_number")
    int accountNumber;

    @JsonProperty("holder_name")
    String holderName;

    @JsonProperty("type")
    AccountType type;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("floor")
    BigDecimal floor;

    public static AccountResponse from(AccountSnapshot account) {
        return AccountResponse.builder()
            .accountNumber(account.getAccountNumber())
            .holderName(account.getHolderName())
            .type(account.getType())
            .balance(account.getBalance())
            .floor(account.getFloor())
            .build();
    }
}
