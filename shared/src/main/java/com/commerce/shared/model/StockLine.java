package com.commerce.shared.model;

import java.util.Objects;

/**
 * A quantity of one SKU.
 */
public record StockLine(String sku, int qty) {

    public StockLine {
        Objects.requireNonNull(sku, "sku");
        if (qty < 1) {
            throw new IllegalArgumentException("qty must be >= 1 for sku " + sku + ", got " + qty);
        }
    }

    public static StockLine of(String sku, int qty) {
        return new StockLine(sku, qty);
    }
}
