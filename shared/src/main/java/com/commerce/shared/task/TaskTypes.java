package com.commerce.shared.task;

/**
 * Wire tags for every component operation, as they appear in {@code Task.type()}.
 * Dispatch never matches on these strings; they exist for logs and the wire envelope.
 */
public final class TaskTypes {

    private TaskTypes() {}

    // ── Inventory ─────────────────────────────────────────────────────────────
    public static final String INVENTORY_CHECK           = "INVENTORY_CHECK";
    public static final String INVENTORY_RESERVE         = "INVENTORY_RESERVE";
    public static final String INVENTORY_RELEASE         = "INVENTORY_RELEASE";
    public static final String INVENTORY_CONSUME         = "INVENTORY_CONSUME";
    public static final String INVENTORY_RENEW           = "INVENTORY_RENEW";
    public static final String INVENTORY_GET             = "INVENTORY_GET";

    // ── Payment ───────────────────────────────────────────────────────────────
    public static final String PAYMENT_AUTHORIZE         = "PAYMENT_AUTHORIZE";
    public static final String PAYMENT_CAPTURE           = "PAYMENT_CAPTURE";
    public static final String PAYMENT_REFUND            = "PAYMENT_REFUND";
    public static final String PAYMENT_STATUS            = "PAYMENT_STATUS";

    // ── Fulfillment ───────────────────────────────────────────────────────────
    public static final String FULFILLMENT_CREATE        = "FULFILLMENT_CREATE";
    public static final String FULFILLMENT_UPDATE_STATUS = "FULFILLMENT_UPDATE_STATUS";
    public static final String FULFILLMENT_CANCEL        = "FULFILLMENT_CANCEL";
    public static final String FULFILLMENT_GET           = "FULFILLMENT_GET";

    // ── Loyalty ───────────────────────────────────────────────────────────────
    public static final String LOYALTY_CALCULATE         = "LOYALTY_CALCULATE";
    public static final String LOYALTY_REDEEM            = "LOYALTY_REDEEM";
    public static final String LOYALTY_ISSUE             = "LOYALTY_ISSUE";
    public static final String LOYALTY_GET               = "LOYALTY_GET";

    // ── Recommendation ────────────────────────────────────────────────────────
    public static final String RECOMMEND_FOR_CART        = "RECOMMEND_FOR_CART";
    public static final String RECOMMEND_ALTERNATIVES    = "RECOMMEND_ALTERNATIVES";

    // ── Post-purchase ─────────────────────────────────────────────────────────
    public static final String PURCHASE_RECORD           = "PURCHASE_RECORD";
    public static final String RETURNS_INITIATE          = "RETURNS_INITIATE";
    public static final String RETURNS_STATUS            = "RETURNS_STATUS";
    public static final String FEEDBACK_SUBMIT           = "FEEDBACK_SUBMIT";
    public static final String WARRANTY_CHECK            = "WARRANTY_CHECK";
}
