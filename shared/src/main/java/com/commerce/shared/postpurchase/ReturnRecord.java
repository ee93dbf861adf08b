package com.commerce.shared.postpurchase;

import com.commerce.shared.model.StockLine;

import java.time.Instant;
import java.util.List;

public record ReturnRecord(String returnId,
                           String orderId,
                           String customerId,
                           List<StockLine> items,
                           String reason,
                           ReturnState status,
                           Instant createdAt,
                           Instant expectedCompleteAt) {

    public ReturnRecord {
        items = List.copyOf(items);
    }
}
