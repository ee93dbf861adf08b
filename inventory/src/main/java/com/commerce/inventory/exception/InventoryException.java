package com.commerce.inventory.exception;

/**
 * Base type for ledger rejections. {@link #code()} is the error code reported
 * at the task boundary.
 */
public abstract class InventoryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected InventoryException(String message) {
        super(message);
    }

    public abstract String code();
}
