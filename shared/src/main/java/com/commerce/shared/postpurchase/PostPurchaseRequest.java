package com.commerce.shared.postpurchase;

import com.commerce.shared.model.StockLine;
import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskTypes;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Operations understood by a {@link PostPurchaseService}. The customer is taken
 * from the enclosing task.
 */
public sealed interface PostPurchaseRequest extends TaskRequest {

    /** Registers a completed order so it can later be returned or reviewed. */
    record RecordPurchase(String orderId, List<StockLine> items, BigDecimal amount) implements PostPurchaseRequest {
        @Override public String type() { return TaskTypes.PURCHASE_RECORD; }
    }

    /** A null {@code reason} is recorded as a plain customer request. */
    record InitiateReturn(String orderId, List<StockLine> items, String reason) implements PostPurchaseRequest {
        @Override public String type() { return TaskTypes.RETURNS_INITIATE; }
    }

    record ReturnStatus(String returnId) implements PostPurchaseRequest {
        @Override public String type() { return TaskTypes.RETURNS_STATUS; }
    }

    /** {@code rating} runs from 1 to 5. */
    record SubmitFeedback(String orderId, int rating, String comments) implements PostPurchaseRequest {
        @Override public String type() { return TaskTypes.FEEDBACK_SUBMIT; }
    }

    record CheckWarranty(String sku, LocalDate purchaseDate) implements PostPurchaseRequest {
        @Override public String type() { return TaskTypes.WARRANTY_CHECK; }
    }
}
