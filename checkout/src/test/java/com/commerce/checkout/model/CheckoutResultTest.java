package com.commerce.checkout.model;

import com.commerce.checkout.saga.FailureReason;
import com.commerce.checkout.saga.SagaStep;
import com.commerce.shared.json.JsonMappers;
import com.commerce.shared.json.TaskEnvelopeMapper;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CheckoutResultTest {

    TaskEnvelopeMapper mapper = new TaskEnvelopeMapper(JsonMappers.wire());

    @Test
    @DisplayName("toWire — failure carries reason, no order id, lowercase wire values")
    void toWire_failure() {
        CheckoutResult result = new CheckoutResult(TaskStatus.FAILED, "order_1a2b3c4d", "sess_1",
                FailureReason.PAYMENT_FAILED,
                List.of(ErrorDetail.of(ErrorCodes.CARD_DECLINED, "Card declined")),
                List.of(NextAction.askCustomer("Try another card")),
                Map.of("reservation", Map.of("reservation_id", "res_order_1a2b3c4d_1")), List.of(), true);

        Map<String, Object> wire = mapper.toMap(result.toWire());

        assertThat(wire).containsKeys("status", "reason", "detail", "next_actions", "reservation")
                .doesNotContainKey("order_id");
        assertThat(wire.get("status")).isEqualTo("failed");
        assertThat(wire.get("reason")).isEqualTo("payment_failed");
        assertThat(mapper.toJson(result.toWire())).contains("\"code\" : \"CARD_DECLINED\"");
    }

    @Test
    @DisplayName("toWire — success carries order id and step payloads in order")
    void toWire_success() {
        CheckoutResult result = new CheckoutResult(TaskStatus.SUCCESS, "order_1a2b3c4d", "sess_1", null,
                null, null, Map.of("payment", "cap_1"), null, false);

        assertThat(result.toWire()).containsExactly(
                entry("status", TaskStatus.SUCCESS),
                entry("order_id", "order_1a2b3c4d"),
                entry("detail", List.of()),
                entry("next_actions", List.of()),
                entry("payment", "cap_1"));
        assertThat(result.payload(SagaStep.CAPTURE_PAYMENT, String.class)).contains("cap_1");
        assertThat(result.payload(SagaStep.CREATE_FULFILLMENT, String.class)).isEmpty();
    }
}
