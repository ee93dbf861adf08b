package com.commerce.shared.payment;

import com.commerce.shared.task.TaskRequest;
import com.commerce.shared.task.TaskTypes;

import java.math.BigDecimal;

/**
 * Operations understood by a {@link PaymentGateway}.
 */
public sealed interface PaymentRequest extends TaskRequest {

    record Authorize(BigDecimal amount, PaymentDetails payment) implements PaymentRequest {
        @Override public String type() { return TaskTypes.PAYMENT_AUTHORIZE; }
    }

    record Capture(String authId) implements PaymentRequest {
        @Override public String type() { return TaskTypes.PAYMENT_CAPTURE; }
    }

    /** Refund a captured or authorized transaction; a null amount refunds the full amount. */
    record Refund(String txId, BigDecimal amount) implements PaymentRequest {
        @Override public String type() { return TaskTypes.PAYMENT_REFUND; }
    }

    /** Look up by transaction id, or by authorization id when {@code txId} is null. */
    record Status(String txId, String authId) implements PaymentRequest {
        @Override public String type() { return TaskTypes.PAYMENT_STATUS; }
    }
}
