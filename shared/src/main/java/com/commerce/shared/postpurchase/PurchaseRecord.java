package com.commerce.shared.postpurchase;

import com.commerce.shared.model.StockLine;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * @param returnableUntil last instant a return for this order is accepted
 */
public record PurchaseRecord(String orderId,
                             String customerId,
                             List<StockLine> items,
                             BigDecimal amount,
                             Instant placedAt,
                             Instant returnableUntil) {

    public PurchaseRecord {
        items = List.copyOf(items);
    }
}
