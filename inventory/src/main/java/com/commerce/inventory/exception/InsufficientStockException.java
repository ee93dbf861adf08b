package com.commerce.inventory.exception;

import com.commerce.shared.task.ErrorCodes;

import java.util.List;
import java.util.stream.Collectors;

public class InsufficientStockException extends InventoryException {

    private static final long serialVersionUID = 1L;

    public record Shortfall(String sku, long requested, int available) {}

    private final List<Shortfall> shortfalls;

    public InsufficientStockException(String sku, int requested, int available) {
        this(List.of(new Shortfall(sku, requested, available)));
    }

    public InsufficientStockException(List<Shortfall> shortfalls) {
        super(shortfalls.stream()
                .map(s -> String.format("Insufficient stock for %s: requested=%d, available=%d",
                        s.sku(), s.requested(), s.available()))
                .collect(Collectors.joining("; ")));
        this.shortfalls = List.copyOf(shortfalls);
    }

    public List<Shortfall> getShortfalls() {
        return shortfalls;
    }

    @Override
    public String code() {
        return ErrorCodes.INSUFFICIENT_STOCK;
    }
}
