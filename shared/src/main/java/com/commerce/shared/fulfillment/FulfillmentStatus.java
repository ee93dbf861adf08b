package com.commerce.shared.fulfillment;

public enum FulfillmentStatus {
    SCHEDULED,
    READY_SOON,
    SHIPPED,
    DELIVERED,
    COLLECTED,
    CANCELLED
}
