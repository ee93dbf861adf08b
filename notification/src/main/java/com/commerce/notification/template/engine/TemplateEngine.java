package com.commerce.notification.template.engine;

import java.util.Map;

import com.commerce.notification.template.NotificationContent;
import com.commerce.shared.notification.CustomerNotifier;

public class TemplateEngine {

    private TemplateEngine() {}

    public static NotificationContent render(String templateId, Map<String, Object> vars) {
        return switch (templateId) {
            case CustomerNotifier.TEMPLATE_ORDER_CONFIRMED -> new NotificationContent(
                    "Your order " + vars.get("orderId") + " is confirmed!",
                    String.format("Your order %s for %s has been confirmed. Expected by %s.",
                            vars.get("orderId"), vars.get("amount"), vars.getOrDefault("eta", "soon")),
                    String.format("Order %s confirmed. Total: %s.", vars.get("orderId"), vars.get("amount"))
            );
            case CustomerNotifier.TEMPLATE_ORDER_FAILED -> new NotificationContent(
                    "We could not place your order",
                    String.format("Your checkout could not be completed. Reason: %s. %s",
                            vars.get("reason"), paymentSentence(vars.get("payment"))),
                    String.format("Checkout failed: %s.", vars.get("reason"))
            );
            case CustomerNotifier.TEMPLATE_PAYMENT_PENDING -> new NotificationContent(
                    "Approve your payment for order " + vars.get("orderId"),
                    String.format("Your order %s is waiting for payment approval (%s). Items are held for you.",
                            vars.get("orderId"), vars.get("txId")),
                    String.format("Approve payment for order %s.", vars.get("orderId"))
            );
            default -> new NotificationContent("Store Notification", vars.toString(), vars.toString());
        };
    }

    // An unknown or missing outcome never claims the customer was not charged
    private static String paymentSentence(Object payment) {
        if (CustomerNotifier.PAYMENT_NOT_CHARGED.equals(payment)) {
            return "You have not been charged.";
        }
        if (CustomerNotifier.PAYMENT_REFUNDED.equals(payment)) {
            return "Your payment has been refunded.";
        }
        return "Your payment is on hold and a refund is pending review. Our team will contact you.";
    }
}
