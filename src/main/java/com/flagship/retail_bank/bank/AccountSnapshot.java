package com.flagship.retail_bank.bank;

import com.flagship.retail_bank.account.Account;
import com.flagship.retail_bank.account.AccountType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable copy of an account's state.
 *
 * Only the Bank creates snapshots, while holding its lock, so the balance is
 * consistent with the ledger at the moment of the read.
 */
@Value
public class AccountSnapshot {
    int accountNumber;
    String holderName;
    AccountType type;
    BigDecimal balance;
    BigDecimal floor;

    static AccountSnapshot of(Account account) {
        return new AccountSnapshot(
            account.getAccountNumber(),
            account.getHolderName(),
            account.getType(),
            account.getBalance(),
            account.getFloor()
        );
    }
}
