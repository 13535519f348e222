package com.flagship.retail_bank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetailBankApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetailBankApplication.class, args);
    }
}
