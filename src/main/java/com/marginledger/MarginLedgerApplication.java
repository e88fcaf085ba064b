package com.marginledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarginLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarginLedgerApplication.class, args);
    }
}
