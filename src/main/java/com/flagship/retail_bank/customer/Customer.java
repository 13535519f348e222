package com.flagship.retail_bank.customer;

import com.flagship.retail_bank.account.Account;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Groups the accounts belonging to one owner.
 *
 * Accounts are shared references; the Bank remains the owner of their lifetime.
 */
@Getter
public class Customer {

    private final int customerId;
    private final String name;
    private final List<Account> accounts = new ArrayList<>();

    public Customer(int customerId, String name) {
        this.customerId = customerId;
        this.name = Objects.requireNonNull(name, "Customer name is required");
    }

    public void addAccount(Account account) {
        accounts.add(Objects.requireNonNull(account, "Account cannot be null"));
    }

    /**
     * Read-only view of the customer's accounts in the order they were added.
     */
    public List<Account> getAccounts() {
        return Collections.unmodifiableList(accounts);
    }

    /**
     * Sum of the current balances of all accounts held by this customer.
     *
     * Reads the balances without the Bank lock; under concurrent transactions
     * the sum may not reflect the latest ledger state.
     */
    public BigDecimal getTotalBalance() {
        return accounts.stream()
            .map(Account::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
