package com.flagship.retail_bank.bank;

import com.flagship.retail_bank.account.Account;
import com.flagship.retail_bank.account.AccountType;
import com.flagship.retail_bank.observability.BankMetrics;
import com.flagship.retail_bank.observability.CorrelationContext;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Application service in front of the {@link Bank}.
 *
 * Adds metrics and request-scoped logging around the core operations.
 * Business rules stay in the Bank and the account variants.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankService {

    private final Bank bank;
    private final BankMetrics bankMetrics;

    @PostConstruct
    void registerGauges() {
        bankMetrics.registerLedgerSizeGauge(bank::getTransactionCount);
    }

    /**
     * Opens an account of the given type.
     *
     * @return Snapshot of the new account, or empty if the number is already taken
     * @throws IllegalArgumentException if the opening balance is below the type's floor
     */
    public Optional<AccountSnapshot> openAccount(AccountType type, int accountNumber, String holderName,
                                         BigDecimal initialBalance) {
        if (type == null) {
            throw new IllegalArgumentException("Account type is required");
        }
        if (holderName == null || holderName.isBlank()) {
            throw new IllegalArgumentException("Holder name is required");
        }
        if (initialBalance != null && initialBalance.compareTo(type.floor()) < 0) {
            bankMetrics.recordAccountOpened(type, "below_floor");
            throw new IllegalArgumentException(String.format(
                "Opening balance %s is below the %s floor of %s", initialBalance, type.label(), type.floor()));
        }

        MDC.put(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY, String.valueOf(accountNumber));
        try {
            Account account = type.open(accountNumber, holderName, initialBalance);
            if (!bank.addAccount(account)) {
                bankMetrics.recordAccountOpened(type, "duplicate");
                return Optional.empty();
            }
            bankMetrics.recordAccountOpened(type, "success");
            Optional<AccountSnapshot> snapshot = bank.getAccountSnapshot(accountNumber);
            log.info("Opened {} account: holder={}, initialBalance={}",
                    type.label(), holderName, snapshot.map(AccountSnapshot::getBalance).orElse(null));
            return snapshot;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }

    public TransactionResult deposit(int accountNumber, BigDecimal amount) {
        return execute(accountNumber, amount, TransactionType.DEPOSIT);
    }

    public TransactionResult withdraw(int accountNumber, BigDecimal amount) {
        return execute(accountNumber, amount, TransactionType.WITHDRAWAL);
    }

    public Optional<AccountSnapshot> findAccount(int accountNumber) {
        return bank.getAccountSnapshot(accountNumber);
    }

    public List<AccountSnapshot> accounts() {
        return bank.getAccountSnapshots();
    }

    public List<Transaction> transactions() {
        return bank.listTransactions();
    }

    public int accountCount() {
        return bank.getAccountCount();
    }

    public int transactionCount() {
        return bank.getTransactionCount();
    }

    private TransactionResult execute(int accountNumber, BigDecimal amount, TransactionType type) {
        long startTime = System.nanoTime();
        MDC.put(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY, String.valueOf(accountNumber));

        try {
            log.debug("Processing {}: amount={}", type.label(), amount);
            TransactionResult result = bank.makeTransaction(accountNumber, amount, type);

            bankMetrics.recordTransaction(type, result.getOutcome());
            bankMetrics.recordTransactionLatency(type, Duration.ofNanos(System.nanoTime() - startTime));

            if (!result.isSuccess()) {
                log.info("{} not applied: outcome={}", type.label(), result.getOutcome());
            }
            return result;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }
}
