package com.commerce.shared.recommendation;

/**
 * Read-only stock lookup used to annotate recommendations.
 */
public interface AvailabilityLookup {

    /** Total units currently available for {@code sku}, 0 when unknown. */
    int availableQuantity(String sku);
}
