package com.flagship.retail_bank.bank.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_bank.account.AccountType;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Request DTO for opening an account.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Account type is required")
    @Pattern(regexp = "(?i)^(SAVINGS|CHECKING)$", message = "Account type must be SAVINGS or CHECKING")
    @JsonProperty("type")
    private String type;

    @NotNull(message = "Account number is required")
    @JsonProperty("account_number")
    private Integer accountNumber;

    @NotBlank(message = "Holder name is required")
    @JsonProperty("holder_name")
    private String holderName;

    @NotNull(message = "Initial balance is required")
    @JsonProperty("initial_balance")
    private BigDecimal initialBalance;

    /**
     * Opening balance must not be below the floor of the requested type.
     * Unknown types and missing balances are reported by the field constraints.
     */
    @JsonIgnore
    @AssertTrue(message = "Initial balance is below the minimum allowed for this account type")
    public boolean isInitialBalanceWithinFloor() {
        if (type == null || initialBalance == null || !type.matches("(?i)^(SAVINGS|CHECKING)$")) {
            return true;
        }
        AccountType accountType = AccountType.valueOf(type.toUpperCase(Locale.ROOT));
        return initialBalance.compareTo(accountType.floor()) >= 0;
    }
}
