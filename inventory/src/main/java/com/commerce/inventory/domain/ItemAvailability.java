package com.commerce.inventory.domain;

/**
 * @param availableQty total units observed
 * @param locationQty  units at the preferred location, null when none was asked for or it is not stocked there
 */
public record ItemAvailability(String sku, int requested, boolean available, int availableQty, Integer locationQty) {
}
