package com.flagship.retail_bank.observability;

import com.flagship.retail_bank.account.AccountType;
import com.flagship.retail_bank.bank.TransactionOutcome;
import com.flagship.retail_bank.bank.TransactionType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Centralized metrics for bank operations.
 *
 * Metrics exposed:
 * - bank.accounts.opened: Counter of opened accounts, tagged by type and status
 * - bank.transactions: Counter of transaction requests, tagged by type and outcome
 * - bank.transaction.latency: Timer per transaction type
 * - bank.ledger.size: Gauge of ledger entries
 */
@Component
public class BankMetrics {

    private final MeterRegistry registry;

    public BankMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAccountOpened(AccountType type, String status) {
        registry.counter("bank.accounts.opened",
                "type", tag(type.name()),
                "status", tag(status)
        ).increment();
    }

    public void recordTransaction(TransactionType type, TransactionOutcome outcome) {
        registry.counter("bank.transactions",
                "type", tag(type.name()),
                "outcome", tag(outcome.name())
        ).increment();
    }

    public void recordTransactionLatency(TransactionType type, Duration duration) {
        registry.timer("bank.transaction.latency",
                "type", tag(type.name())
        ).record(duration);
    }

    /**
     * Registers a gauge reporting the number of ledger entries.
     */
    public void registerLedgerSizeGauge(Supplier<Number> supplier) {
        Gauge.builder("bank.ledger.size", supplier, s -> s.get().doubleValue())
                .description("Number of transactions recorded in the ledger")
                .strongReference(true)
                .register(registry);
    }

    private String tag(String value) {
        if (value == null) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
