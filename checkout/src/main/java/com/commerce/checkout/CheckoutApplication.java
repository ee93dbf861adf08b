package com.commerce.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Checkout Service Entry Point
 *
 * Saga orchestrator over the inventory ledger and the in-process
 * payment, fulfillment, loyalty, recommendation and notification collaborators.
 */
@SpringBootApplication
public class CheckoutApplication {
    public static void main(String[] args) {
        SpringApplication.run(CheckoutApplication.class, args);
    }
}
