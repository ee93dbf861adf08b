package com.commerce.checkout.config;

import com.commerce.inventory.ledger.InventoryLedger;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ledger seed and reservation policy.
 *
 * checkout:
 *   inventory:
 *     default-hold: 15m
 *     fallback-location: WAREHOUSE
 *     expiry-sweep-interval-ms: 30000
 *     stock:
 *       "[TSHIRT-RED-XL]": { STORE_1: 5, WAREHOUSE: 5 }
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "checkout.inventory")
public class InventoryProperties {

    /** How long a reservation holds stock when the caller names no hold. */
    private Duration defaultHold = Duration.ofMinutes(15);

    /** Location credited when a released line's origin has disappeared. */
    private String fallbackLocation = InventoryLedger.DEFAULT_FALLBACK_LOCATION;

    private long expirySweepIntervalMs = 30_000L;

    /** sku -> location -> quantity */
    private Map<String, Map<String, Integer>> stock = new LinkedHashMap<>();
}
