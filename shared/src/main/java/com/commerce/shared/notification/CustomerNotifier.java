package com.commerce.shared.notification;

/**
 * Delivers customer-facing messages. Callers treat delivery as best-effort.
 */
public interface CustomerNotifier {

    String CHANNEL_EMAIL = "email";
    String CHANNEL_SMS   = "sms";

    String TEMPLATE_ORDER_CONFIRMED = "order-confirmed";
    String TEMPLATE_ORDER_FAILED    = "order-failed";
    String TEMPLATE_PAYMENT_PENDING = "payment-pending";

    /** Values of the {@code payment} variable of an order-failed message. */
    String PAYMENT_NOT_CHARGED   = "not_charged";
    String PAYMENT_REFUNDED      = "refunded";
    String PAYMENT_UNDER_REVIEW  = "under_review";

    void notify(CustomerNotification notification);
}
