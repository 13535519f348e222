package com.flagship.retail_bank.health;

import com.flagship.retail_bank.bank.BankService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Reports the number of registered accounts and recorded transactions.
 */
@RestController
public class HealthController {

    private final BankService bankService;

    public HealthController(BankService bankService) {
        this.bankService = bankService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("accounts", bankService.accountCount());
        response.put("transactions", bankService.transactionCount());
        return ResponseEntity.ok(response);
    }
}
