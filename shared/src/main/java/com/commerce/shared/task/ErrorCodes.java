package com.commerce.shared.task;

/**
 * Canonical error codes carried in {@link ErrorDetail#code()}.
 * Callers branch on these values, so renaming one is a breaking change.
 */
public final class ErrorCodes {

    private ErrorCodes() {}

    // ── Ledger / task boundary ────────────────────────────────────────────────
    public static final String INSUFFICIENT_STOCK      = "INSUFFICIENT_STOCK";
    public static final String INVALID_RESERVATION     = "INVALID_RESERVATION";
    public static final String DUPLICATE_RESERVATION   = "DUPLICATE_RESERVATION";
    public static final String MISSING_FIELDS          = "MISSING_FIELDS";
    public static final String SKU_NOT_FOUND           = "SKU_NOT_FOUND";

    // ── Saga step execution ───────────────────────────────────────────────────
    public static final String STEP_TIMEOUT            = "STEP_TIMEOUT";
    public static final String COLLABORATOR_ERROR      = "COLLABORATOR_ERROR";
    public static final String COMPENSATION_FAILED     = "COMPENSATION_FAILED";

    // ── Payment ───────────────────────────────────────────────────────────────
    public static final String INVALID_AMOUNT          = "INVALID_AMOUNT";
    public static final String INVALID_CARD            = "INVALID_CARD";
    public static final String INSUFFICIENT_FUNDS      = "INSUFFICIENT_FUNDS";
    public static final String CARD_DECLINED           = "CARD_DECLINED";
    public static final String INVALID_UPI             = "INVALID_UPI";
    public static final String UPI_FAILURE             = "UPI_FAILURE";
    public static final String INSUFFICIENT_GIFT_BALANCE = "INSUFFICIENT_GIFT_BALANCE";
    public static final String UNSUPPORTED_METHOD      = "UNSUPPORTED_METHOD";
    public static final String AUTH_NOT_FOUND          = "AUTH_NOT_FOUND";
    public static final String TX_NOT_FOUND            = "TX_NOT_FOUND";
    public static final String REFUND_NOT_ALLOWED      = "REFUND_NOT_ALLOWED";

    // ── Fulfillment ───────────────────────────────────────────────────────────
    public static final String INVENTORY_NOT_CONFIRMED = "INVENTORY_NOT_CONFIRMED";
    public static final String NO_STORE_AVAILABLE      = "NO_STORE_AVAILABLE";
    public static final String FULFILLMENT_NOT_FOUND   = "FULFILLMENT_NOT_FOUND";

    // ── Loyalty ───────────────────────────────────────────────────────────────
    public static final String INSUFFICIENT_POINTS     = "INSUFFICIENT_POINTS";
    public static final String INVALID_REDEEM          = "INVALID_REDEEM";

    // ── Recommendation ────────────────────────────────────────────────────────
    public static final String SKU_NOT_IN_CATALOG      = "SKU_NOT_IN_CATALOG";

    // ── Post-purchase ─────────────────────────────────────────────────────────
    public static final String ORDER_NOT_FOUND         = "ORDER_NOT_FOUND";
    public static final String DUPLICATE_ORDER         = "DUPLICATE_ORDER";
    public static final String RETURN_WINDOW_CLOSED    = "RETURN_WINDOW_CLOSED";
    public static final String INVALID_RETURN_ITEMS    = "INVALID_RETURN_ITEMS";
    public static final String INVALID_RETURN_ID       = "INVALID_RETURN_ID";
    public static final String INVALID_RATING          = "INVALID_RATING";
    public static final String INVALID_DATE            = "INVALID_DATE";
}
