package com.commerce.inventory.exception;

import com.commerce.shared.task.ErrorCodes;

/**
 * Unknown reservation id, including one that was already released.
 */
public class ReservationNotFoundException extends InventoryException {

    private static final long serialVersionUID = 1L;

    private final String reservationId;

    public ReservationNotFoundException(String reservationId) {
        super("Reservation missing or already released: " + reservationId);
        this.reservationId = reservationId;
    }

    public String getReservationId() {
        return reservationId;
    }

    @Override
    public String code() {
        return ErrorCodes.INVALID_RESERVATION;
    }
}
