package com.commerce.inventory.exception;

import com.commerce.shared.task.ErrorCodes;

public class DuplicateReservationException extends InventoryException {

    private static final long serialVersionUID = 1L;

    private final String orderId;
    private final String existingReservationId;

    public DuplicateReservationException(String orderId, String existingReservationId) {
        super(String.format("Order %s already holds reservation %s", orderId, existingReservationId));
        this.orderId = orderId;
        this.existingReservationId = existingReservationId;
    }

    public String getOrderId() {
        return orderId;
    }

    public String getExistingReservationId() {
        return existingReservationId;
    }

    @Override
    public String code() {
        return ErrorCodes.DUPLICATE_RESERVATION;
    }
}
