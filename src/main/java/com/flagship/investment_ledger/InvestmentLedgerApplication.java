package com.flagship.investment_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvestmentLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvestmentLedgerApplication.class, args);
    }
}
