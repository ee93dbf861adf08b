package com.commerce.inventory.domain;

import com.commerce.shared.model.StockLine;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A hold on stock for one order. Lives in the ledger until it is released
 * (explicitly or by expiry); a successful checkout simply never releases it.
 */
public record Reservation(String reservationId,
                          String orderId,
                          List<ReservedLine> lines,
                          Duration hold,
                          Instant createdAt) {

    public Reservation {
        lines = List.copyOf(lines);
    }

    public Instant expiresAt() {
        return createdAt.plus(hold);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt());
    }

    public List<StockLine> items() {
        return lines.stream().map(line -> new StockLine(line.sku(), line.qty())).toList();
    }

    public int quantityOf(String sku) {
        return lines.stream().filter(line -> line.sku().equals(sku)).mapToInt(ReservedLine::qty).sum();
    }
}
