package com.repledger.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RepLedger engine application.
 *
 * Stake-backed Bayesian reputation for supply-network actors.
 * Java 17 + Spring Boot 3.2.x
 */
@SpringBootApplication(scanBasePackages = "com.repledger.engine")
public class RepLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepLedgerApplication.class, args);
    }
}
