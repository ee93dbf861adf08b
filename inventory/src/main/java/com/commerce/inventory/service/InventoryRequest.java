package com.commerce.inventory.service;

import com.commerce.shared.model.StockLine;
import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskTypes;

import java.util.List;

/**
 * Operations understood by {@link InventoryService}.
 */
public sealed interface InventoryRequest extends TaskRequest {

    record Check(List<StockLine> items, String preferredLocation) implements InventoryRequest {
        @Override public String type() { return TaskTypes.INVENTORY_CHECK; }
    }

    /** A null {@code holdMinutes} uses the service default. */
    record Reserve(String orderId, List<StockLine> items, Integer holdMinutes) implements InventoryRequest {
        @Override public String type() { return TaskTypes.INVENTORY_RESERVE; }
    }

    record Release(String reservationId) implements InventoryRequest {
        @Override public String type() { return TaskTypes.INVENTORY_RELEASE; }
    }

    /** Settles the reservation of a completed order; stock stays withdrawn. */
    record Consume(String reservationId) implements InventoryRequest {
        @Override public String type() { return TaskTypes.INVENTORY_CONSUME; }
    }

    /** Extends a live hold; a null {@code holdMinutes} uses the service default. */
    record Renew(String reservationId, Integer holdMinutes) implements InventoryRequest {
        @Override public String type() { return TaskTypes.INVENTORY_RENEW; }
    }

    /** A null {@code sku} asks for every entry. */
    record Get(String sku) implements InventoryRequest {
        @Override public String type() { return TaskTypes.INVENTORY_GET; }
    }
}
