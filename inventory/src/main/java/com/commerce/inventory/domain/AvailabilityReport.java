package com.commerce.inventory.domain;

import java.util.List;

public record AvailabilityReport(List<ItemAvailability> items, String preferredLocation) {

    public AvailabilityReport {
        items = List.copyOf(items);
    }

    public boolean allAvailable() {
        return items.stream().allMatch(ItemAvailability::available);
    }

    public List<String> unavailableSkus() {
        return items.stream().filter(item -> !item.available()).map(ItemAvailability::sku).toList();
    }
}
