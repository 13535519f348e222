package com.flagship.retail_bank.config;

import com.flagship.retail_bank.bank.Bank;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composes the Bank instance owned by this application.
 */
@Configuration
public class BankConfig {

    @Bean
    public Bank bank() {
        return new Bank();
    }
}
