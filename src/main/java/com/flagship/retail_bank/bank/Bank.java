package com.flagship.retail_bank.bank;

import com.flagship.retail_bank.account.Account;
import com.flagship.retail_bank.account.AccountType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The bank aggregate: owns the accounts and the transaction ledger.
 *
 * Enforces the core invariants:
 * 1. Account numbers are unique within the bank
 * 2. A transaction is appended if and only if its balance change succeeded
 * 3. Transaction ids increase by exactly one per appended transaction
 * 4. The ledger is append-only
 *
 * Every public method synchronizes on the Bank instance, so a lookup, the
 * policy check, the balance change and the ledger append are observed as one
 * unit by concurrent callers.
 */
@Slf4j
public class Bank {

    public static final String NO_TRANSACTIONS = "No transactions to show.";

    private final Map<Integer, Account> accounts = new LinkedHashMap<>();
    private final List<Transaction> transactions = new ArrayList<>();
    private long transactionCounter = 0;

    /**
     * Registers an account.
     *
     * @param account Account to register
     * @return true if registered, false if an account with the same number exists
     * @throws IllegalArgumentException if the opening balance is below the account's floor
     */
    public synchronized boolean addAccount(Account account) {
        if (account == null) {
            throw new IllegalArgumentException("Account cannot be null");
        }
        if (!account.isWithinFloor()) {
            throw new IllegalArgumentException(String.format(
                "Opening balance %s is below the %s floor of %s",
                account.getBalance(), account.getType().label(), account.getFloor()));
        }
        if (accounts.containsKey(account.getAccountNumber())) {
            log.warn("Account {} already exists, registration rejected", account.getAccountNumber());
            return false;
        }
        accounts.put(account.getAccountNumber(), account);
        log.info("Account {} added for {}", account.getAccountNumber(), account.getHolderName());
        return true;
    }

    /**
     * Finds an account by number. Never throws.
     */
    public synchronized Optional<Account> getAccount(int accountNumber) {
        return Optional.ofNullable(accounts.get(accountNumber));
    }

    /**
     * All accounts in registration order.
     */
    public synchronized List<Account> getAccounts() {
        return List.copyOf(accounts.values());
    }

    /**
     * Point-in-time copy of an account, taken under the bank lock.
     */
    public synchronized Optional<AccountSnapshot> getAccountSnapshot(int accountNumber) {
        return getAccount(accountNumber).map(AccountSnapshot::of);
    }

    /**
     * Point-in-time copies of all accounts in registration order.
     */
    public synchronized List<AccountSnapshot> getAccountSnapshots() {
        return accounts.values().stream()
            .map(AccountSnapshot::of)
            .toList();
    }

    /**
     * Applies a deposit or withdrawal to an account and records it in the ledger.
     *
     * Failures are reported through the result's outcome; no state changes on failure.
     *
     * @param accountNumber Target account
     * @param amount Positive amount
     * @param type Deposit or withdrawal
     * @return Outcome, with the new transaction and balance on success
     */
    public synchronized TransactionResult makeTransaction(int accountNumber, BigDecimal amount,
                                                          TransactionType type) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            log.warn("Rejected {} with non-positive amount {} on account {}",
                    type.label(), amount, accountNumber);
            return TransactionResult.of(TransactionOutcome.INVALID_AMOUNT);
        }

        Account account = accounts.get(accountNumber);
        if (account == null) {
            log.warn("Account not found: {}", accountNumber);
            return TransactionResult.of(TransactionOutcome.ACCOUNT_NOT_FOUND);
        }

        boolean success = switch (type) {
            case DEPOSIT -> {
                account.deposit(amount);
                yield true;
            }
            case WITHDRAWAL -> account.withdraw(amount);
        };

        if (!success) {
            TransactionOutcome outcome = account.getType() == AccountType.SAVINGS
                ? TransactionOutcome.INSUFFICIENT_FUNDS
                : TransactionOutcome.OVERDRAFT_LIMIT_REACHED;
            log.info("{} of {} on account {} rejected: {}",
                    type.label(), amount, accountNumber, outcome.message());
            return TransactionResult.rejected(outcome, account.getBalance());
        }

        Transaction transaction = Transaction.record(++transactionCounter, accountNumber, amount, type);
        transactions.add(transaction);
        log.info("Transaction successful: id={}, type={}, amount={}, account={}, balance={}",
                transaction.getId(), type.label(), amount, accountNumber, account.getBalance());
        return TransactionResult.success(transaction, account.getBalance());
    }

    /**
     * Snapshot of the ledger in append order.
     */
    public synchronized List<Transaction> listTransactions() {
        return Collections.unmodifiableList(new ArrayList<>(transactions));
    }

    /**
     * Display lines for the ledger, or a single "no transactions" line when empty.
     * The lines are also written to the log.
     */
    public synchronized List<String> printTransactions() {
        if (transactions.isEmpty()) {
            log.info(NO_TRANSACTIONS);
            return List.of(NO_TRANSACTIONS);
        }
        List<String> lines = transactions.stream()
            .map(Transaction::describe)
            .toList();
        lines.forEach(log::info);
        return lines;
    }

    public synchronized int getTransactionCount() {
        return transactions.size();
    }

    public synchronized int getAccountCount() {
        return accounts.size();
    }
}
