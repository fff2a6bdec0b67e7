package com.flagship.personal_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PersonalLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PersonalLedgerApplication.class, args);
    }
}
