package com.flagship.retail_bank.bank;

import com.flagship.retail_bank.account.CheckingAccount;
import com.flagship.retail_bank.account.SavingsAccount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent callers must never push an account past its floor, and the
 * ledger must stay contiguous.
 */
class BankConcurrencyTest {

    @Test
    @DisplayName("Concurrent withdrawals never breach the savings floor")
    void testConcurrentSavingsWithdrawals() throws Exception {
        Bank bank = new Bank();
        bank.addAccount(new SavingsAccount(1, "Alice", new BigDecimal("100")));

        int numThreads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(numThreads);
        AtomicInteger succeeded = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    if (bank.makeTransaction(1, new BigDecimal("10"), TransactionType.WITHDRAWAL).isSuccess()) {
                        succeeded.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(10, succeeded.get());
        assertEquals(0, BigDecimal.ZERO.compareTo(bank.getAccount(1).orElseThrow().getBalance()));
        assertEquals(10, bank.getTransactionCount());
    }

    @Test
    @DisplayName("Concurrent mixed operations keep ledger ids contiguous")
    void testConcurrentIdsContiguous() throws Exception {
        Bank bank = new Bank();
        bank.addAccount(new CheckingAccount(2, "Bob", BigDecimal.ZERO));

        int numThreads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch done = new CountDownLatch(numThreads);

        for (int i = 0; i < numThreads; i++) {
            final TransactionType type = i % 2 == 0 ? TransactionType.DEPOSIT : TransactionType.WITHDRAWAL;
            executor.submit(() -> {
                try {
                    for (int j = 0; j < perThread; j++) {
                        bank.makeTransaction(2, BigDecimal.ONE, type);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        List<Transaction> ledger = bank.listTransactions();
        for (int i = 0; i < ledger.size(); i++) {
            assertEquals(i + 1L, ledger.get(i).getId());
        }
        assertEquals(numThreads * perThread, ledger.size());
        assertEquals(0, BigDecimal.ZERO.compareTo(bank.getAccount(2).orElseThrow().getBalance()));
    }
}
