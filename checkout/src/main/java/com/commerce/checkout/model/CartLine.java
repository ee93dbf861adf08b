package com.commerce.checkout.model;

import com.commerce.shared.model.StockLine;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One cart line. {@code price} is the unit price.
 */
public record CartLine(String sku, int qty, BigDecimal price) {

    public CartLine {
        Objects.requireNonNull(sku, "sku");
        Objects.requireNonNull(price, "price");
        if (qty < 1) {
            throw new IllegalArgumentException("qty must be >= 1 for sku " + sku + ", got " + qty);
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price must not be negative for sku " + sku);
        }
    }

    public static CartLine of(String sku, int qty, String price) {
        return new CartLine(sku, qty, new BigDecimal(price));
    }

    public BigDecimal lineTotal() {
        return price.multiply(BigDecimal.valueOf(qty));
    }

    public StockLine toStockLine() {
        return new StockLine(sku, qty);
    }
}
