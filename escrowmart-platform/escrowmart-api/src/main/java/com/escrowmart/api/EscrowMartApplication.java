package com.escrowmart.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * EscrowMart API Application
 *
 * Single-item escrow marketplace: listings, bids, escrowed selection,
 * fulfillment and administrator arbitration.
 */
@SpringBootApplication(scanBasePackages = "com.escrowmart")
@EntityScan(basePackages = "com.escrowmart.core.domain")
@EnableJpaRepositories(basePackages = "com.escrowmart.core.repository")
public class EscrowMartApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowMartApplication.class, args);
    }
}
