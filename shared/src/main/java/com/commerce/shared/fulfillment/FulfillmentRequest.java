package com.commerce.shared.fulfillment;

import com.commerce.shared.model.Address;
import com.commerce.shared.model.StockLine;
import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskTypes;

import java.util.List;

/**
 * Operations understood by a {@link FulfillmentService}.
 */
public sealed interface FulfillmentRequest extends TaskRequest {

    /**
     * @param storeId            preferred pickup store, click-and-collect only, may be null
     * @param inventoryConfirmed whether stock is already held for the order
     */
    record Create(String orderId,
                  List<StockLine> items,
                  Address address,
                  FulfillmentMode mode,
                  String storeId,
                  boolean inventoryConfirmed) implements FulfillmentRequest {
        @Override public String type() { return TaskTypes.FULFILLMENT_CREATE; }
    }

    record UpdateStatus(String fulfillmentId, FulfillmentStatus status) implements FulfillmentRequest {
        @Override public String type() { return TaskTypes.FULFILLMENT_UPDATE_STATUS; }
    }

    record Cancel(String fulfillmentId, String reason) implements FulfillmentRequest {
        @Override public String type() { return TaskTypes.FULFILLMENT_CANCEL; }
    }

    record Get(String fulfillmentId) implements FulfillmentRequest {
        @Override public String type() { return TaskTypes.FULFILLMENT_GET; }
    }
}
