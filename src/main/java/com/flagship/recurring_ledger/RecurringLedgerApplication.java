package com.flagship.recurring_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RecurringLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecurringLedgerApplication.class, args);
    }
}
