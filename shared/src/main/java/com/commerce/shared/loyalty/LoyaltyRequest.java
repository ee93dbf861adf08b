package com.commerce.shared.loyalty;

import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskTypes;

import java.math.BigDecimal;

/**
 * Operations understood by a {@link LoyaltyService}. The customer is taken
 * from the enclosing task.
 */
public sealed interface LoyaltyRequest extends TaskRequest {

    record Calculate(BigDecimal orderAmount) implements LoyaltyRequest {
        @Override public String type() { return TaskTypes.LOYALTY_CALCULATE; }
    }

    record Redeem(String orderId, int amountToRedeem) implements LoyaltyRequest {
        @Override public String type() { return TaskTypes.LOYALTY_REDEEM; }
    }

    record Issue(String orderId, BigDecimal orderAmount) implements LoyaltyRequest {
        @Override public String type() { return TaskTypes.LOYALTY_ISSUE; }
    }

    record Balance() implements LoyaltyRequest {
        @Override public String type() { return TaskTypes.LOYALTY_GET; }
    }
}
