package com.commerce.shared.fulfillment;

import com.commerce.shared.model.StockLine;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Shipping or pickup record created for a paid order.
 * {@code storeId} is set for click-and-collect only.
 */
public record FulfillmentRecord(String fulfillmentId,
                                String orderId,
                                FulfillmentMode mode,
                                FulfillmentStatus status,
                                LocalDate eta,
                                String slot,
                                String storeId,
                                List<StockLine> items,
                                Instant createdAt,
                                Instant updatedAt,
                                String cancelReason) {

    public FulfillmentRecord {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public FulfillmentRecord withStatus(FulfillmentStatus newStatus, Instant at) {
        return new FulfillmentRecord(fulfillmentId, orderId, mode, newStatus, eta, slot, storeId,
                items, createdAt, at, cancelReason);
    }

    public FulfillmentRecord cancelled(String reason, Instant at) {
        return new FulfillmentRecord(fulfillmentId, orderId, mode, FulfillmentStatus.CANCELLED, eta, slot,
                storeId, items, createdAt, at, reason);
    }
}
