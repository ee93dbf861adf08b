package com.commerce.notification.template.engine;

import com.commerce.notification.template.NotificationContent;
import com.commerce.shared.notification.CustomerNotifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TemplateEngineTest {

    @Test
    @DisplayName("order-confirmed — mentions order id and amount")
    void orderConfirmed() {
        NotificationContent content = TemplateEngine.render(CustomerNotifier.TEMPLATE_ORDER_CONFIRMED,
                Map.of("orderId", "order_1a2b3c4d", "amount", "1598"));

        assertThat(content.subject()).contains("order_1a2b3c4d");
        assertThat(content.body()).contains("1598").contains("soon");
        assertThat(content.sms()).startsWith("Order order_1a2b3c4d confirmed");
    }

    @Test
    @DisplayName("order-failed — carries the reason")
    void orderFailed() {
        NotificationContent content = TemplateEngine.render(CustomerNotifier.TEMPLATE_ORDER_FAILED,
                Map.of("reason", "payment_failed"));

        assertThat(content.body()).contains("payment_failed");
    }

    @Test
    @DisplayName("order-failed — says not charged only when nothing was captured")
    void orderFailed_notCharged() {
        NotificationContent content = TemplateEngine.render(CustomerNotifier.TEMPLATE_ORDER_FAILED,
                Map.of("reason", "payment_failed", "payment", CustomerNotifier.PAYMENT_NOT_CHARGED));

        assertThat(content.body()).contains("You have not been charged.");
    }

    @Test
    @DisplayName("order-failed — fulfillment failure with payment still held promises a review, not a clean slate")
    void orderFailed_fulfillmentFailedUnderReview() {
        NotificationContent content = TemplateEngine.render(CustomerNotifier.TEMPLATE_ORDER_FAILED,
                Map.of("reason", "fulfillment_failed", "compensated", false,
                        "payment", CustomerNotifier.PAYMENT_UNDER_REVIEW));

        assertThat(content.body())
                .contains("fulfillment_failed")
                .contains("refund is pending review")
                .doesNotContain("not been charged");
    }

    @Test
    @DisplayName("order-failed — unwound saga reports the refund")
    void orderFailed_refunded() {
        NotificationContent content = TemplateEngine.render(CustomerNotifier.TEMPLATE_ORDER_FAILED,
                Map.of("reason", "fulfillment_failed", "compensated", true,
                        "payment", CustomerNotifier.PAYMENT_REFUNDED));

        assertThat(content.body()).contains("has been refunded").doesNotContain("not been charged");
    }

    @Test
    @DisplayName("order-failed — missing payment outcome never claims the customer was not charged")
    void orderFailed_unknownOutcome() {
        NotificationContent content = TemplateEngine.render(CustomerNotifier.TEMPLATE_ORDER_FAILED,
                Map.of("reason", "capture_failed"));

        assertThat(content.body()).doesNotContain("not been charged");
    }

    @Test
    @DisplayName("unknown template — falls back to the raw variables")
    void unknownTemplate() {
        NotificationContent content = TemplateEngine.render("nope", Map.of("k", "v"));

        assertThat(content.subject()).isEqualTo("Store Notification");
        assertThat(content.body()).contains("k=v");
    }
}
