package com.flagship.retail_bank.bank;

import com.flagship.retail_bank.account.AccountType;
import com.flagship.retail_bank.bank.dto.AccountResponse;
import com.flagship.retail_bank.bank.dto.AmountRequest;
import com.flagship.retail_bank.bank.dto.CreateAccountRequest;
import com.flagship.retail_bank.bank.dto.TransactionListResponse;
import com.flagship.retail_bank.bank.dto.TransactionResultResponse;
import com.flagship.retail_bank.bank.exception.AccountNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * REST Controller for account and ledger operations.
 *
 * Exposes the five bank operations:
 * - open an account
 * - deposit
 * - withdraw
 * - view an account balance
 * - list the transaction ledger
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class BankController {

    private final BankService bankService;

    /**
     * Opens a savings or checking account.
     *
     * @return 201 with the new account, 409 if the number is already in use,
     *         400 if the opening balance is below the type's floor
     */
    @PostMapping("/accounts")
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        AccountType type = AccountType.valueOf(request.getType().toUpperCase(Locale.ROOT));

        log.info("Received account creation request: type={}, accountNumber={}",
                type, request.getAccountNumber());

        AccountSnapshot account = bankService.openAccount(type, request.getAccountNumber(),
                request.getHolderName(), request.getInitialBalance())
            .orElseThrow(() -> new IllegalStateException(
                "Account " + request.getAccountNumber() + " already exists"));

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/accounts")
    public List<AccountResponse> listAccounts() {
        return bankService.accounts().stream()
            .map(AccountResponse::from)
            .toList();
    }

    /**
     * Returns an account with its current balance.
     */
    @GetMapping("/accounts/{accountNumber}")
    public AccountResponse getAccount(@PathVariable("accountNumber") int accountNumber) {
        return bankService.findAccount(accountNumber)
            .map(AccountResponse::from)
            .orElseThrow(() -> new AccountNotFoundException(accountNumber));
    }

    @PostMapping("/accounts/{accountNumber}/deposits")
    public ResponseEntity<TransactionResultResponse> deposit(@PathVariable("accountNumber") int accountNumber,
                                                             @Valid @RequestBody AmountRequest request) {
        return toResponse(bankService.deposit(accountNumber, request.getAmount()));
    }

    @PostMapping("/accounts/{accountNumber}/withdrawals")
    public ResponseEntity<TransactionResultResponse> withdraw(@PathVariable("accountNumber") int accountNumber,
                                                              @Valid @RequestBody AmountRequest request) {
        return toResponse(bankService.withdraw(accountNumber, request.getAmount()));
    }

    /**
     * Lists the ledger in the order transactions were recorded.
     */
    @GetMapping("/transactions")
    public TransactionListResponse listTransactions() {
        return TransactionListResponse.from(bankService.transactions());
    }

    private ResponseEntity<TransactionResultResponse> toResponse(TransactionResult result) {
        HttpStatus status = switch (result.getOutcome()) {
            case SUCCESS -> HttpStatus.OK;
            case ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS, OVERDRAFT_LIMIT_REACHED -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        return ResponseEntity.status(status).body(TransactionResultResponse.from(result));
    }
}
