package com.commerce.checkout.saga;

/**
 * Checkout steps in execution order. Best-effort steps never end the saga.
 */
public enum SagaStep {
    CHECK_INVENTORY("inventory", false),
    RECOMMEND("recommendations", true),
    LOYALTY_CALCULATE("loyalty_quote", true),
    RESERVE("reservation", false),
    AUTHORIZE_PAYMENT("authorization", false),
    CAPTURE_PAYMENT("payment", false),
    CREATE_FULFILLMENT("fulfillment", false),
    ISSUE_LOYALTY("loyalty", true),
    RECORD_PURCHASE("purchase", true);

    private final String payloadKey;
    private final boolean bestEffort;

    SagaStep(String payloadKey, boolean bestEffort) {
        this.payloadKey = payloadKey;
        this.bestEffort = bestEffort;
    }

    /** Key under which the step's payload appears in the checkout result. */
    public String payloadKey() {
        return payloadKey;
    }

    public boolean isBestEffort() {
        return bestEffort;
    }
}
