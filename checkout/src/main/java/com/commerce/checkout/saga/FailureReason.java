package com.commerce.checkout.saga;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse cause of a failed checkout, one per required step.
 */
public enum FailureReason {
    INVENTORY_UNAVAILABLE(SagaStep.CHECK_INVENTORY),
    RESERVE_FAILED(SagaStep.RESERVE),
    PAYMENT_FAILED(SagaStep.AUTHORIZE_PAYMENT),
    CAPTURE_FAILED(SagaStep.CAPTURE_PAYMENT),
    FULFILLMENT_FAILED(SagaStep.CREATE_FULFILLMENT);

    private final SagaStep step;

    FailureReason(SagaStep step) {
        this.step = step;
    }

    public SagaStep step() {
        return step;
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
