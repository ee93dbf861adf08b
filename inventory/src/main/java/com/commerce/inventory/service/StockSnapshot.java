package com.commerce.inventory.service;

import com.commerce.inventory.domain.StockEntry;

import java.util.List;

public record StockSnapshot(List<StockEntry> entries) {

    public StockSnapshot {
        entries = List.copyOf(entries);
    }
}
