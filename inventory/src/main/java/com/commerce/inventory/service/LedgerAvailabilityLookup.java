package com.commerce.inventory.service;

import com.commerce.inventory.domain.StockEntry;
import com.commerce.inventory.ledger.InventoryLedger;
import com.commerce.shared.recommendation.AvailabilityLookup;
import lombok.RequiredArgsConstructor;

/**
 * Exposes ledger quantities to collaborators that only need to read them.
 */
@RequiredArgsConstructor
public class LedgerAvailabilityLookup implements AvailabilityLookup {

    private final InventoryLedger ledger;

    @Override
    public int availableQuantity(String sku) {
        return ledger.get(sku).map(StockEntry::quantity).orElse(0);
    }
}
