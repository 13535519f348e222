package com.flagship.retail_bank.account;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Savings account rules:
 * - every deposit earns a 3% bonus on the deposited amount
 * - withdrawals never take the balance below zero
 */
class SavingsAccountTest {

    private SavingsAccount account;

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            "Expected " + expected + " but was " + actual);
    }

    @BeforeEach
    void setUp() {
        account = new SavingsAccount(1, "Alice", new BigDecimal("100.00"));
    }

    @Test
    @DisplayName("Deposit credits amount plus 3% interest")
    void testDepositAddsInterest() {
        account.deposit(new BigDecimal("100"));

        assertAmount("203.00", account.getBalance());
    }

    @ParameterizedTest(name = "balance {0} + deposit {1} -> {2}")
    @CsvSource({
        "0, 50, 51.50",
        "10.00, 0.01, 10.0103",
        "1000, 250.50, 1258.015"
    })
    @DisplayName("Deposit result equals old balance plus amount times 1.03")
    void testDepositFormula(String balance, String amount, String expected) {
        SavingsAccount savings = new SavingsAccount(7, "Carol", new BigDecimal(balance));

        savings.deposit(new BigDecimal(amount));

        assertAmount(expected, savings.getBalance());
    }

    @Test
    @DisplayName("interestFor reports the bonus without changing the balance")
    void testInterestFor() {
        assertAmount("3.00", account.interestFor(new BigDecimal("100")));
        assertAmount("100.00", account.getBalance());
    }

    @Test
    @DisplayName("Withdrawal within balance succeeds")
    void testWithdrawWithinBalance() {
        assertTrue(account.withdraw(new BigDecimal("40")));
        assertAmount("60.00", account.getBalance());
    }

    @Test
    @DisplayName("Withdrawal down to exactly zero succeeds")
    void testWithdrawToZero() {
        assertTrue(account.withdraw(new BigDecimal("100.00")));
        assertAmount("0", account.getBalance());
    }

    @Test
    @DisplayName("Withdrawal below zero fails and leaves balance unchanged")
    void testWithdrawInsufficientFunds() {
        SavingsAccount savings = new SavingsAccount(3, "Dave", new BigDecimal("50"));

        assertFalse(savings.withdraw(new BigDecimal("60")));
        assertAmount("50", savings.getBalance());
    }

    @Test
    @DisplayName("Account level deposit accepts a negative amount and still applies the formula")
    void testDepositNegativeAmountIsPermissive() {
        // The Bank rejects non-positive amounts; the account itself only does the arithmetic.
        account.deposit(new BigDecimal("-10"));

        assertAmount("89.70", account.getBalance());
    }

    @Test
    @DisplayName("Floor and type describe the savings variant")
    void testFloorAndType() {
        assertAmount("0", account.getFloor());
        assertEquals(AccountType.SAVINGS, account.getType());
        assertEquals(1, account.getAccountNumber());
        assertEquals("Alice", account.getHolderName());
    }

    @Test
    @DisplayName("Null opening balance starts at zero")
    void testNullInitialBalance() {
        SavingsAccount savings = new SavingsAccount(9, "Erin", null);

        assertAmount("0", savings.getBalance());
    }
}
