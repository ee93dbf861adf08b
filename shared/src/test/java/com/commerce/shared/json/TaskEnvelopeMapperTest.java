package com.commerce.shared.json;

import com.commerce.shared.model.StockLine;
import com.commerce.shared.payment.PaymentRequest;
import com.commerce.shared.recommendation.RecommendationRequest;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import com.commerce.shared.task.TaskTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskEnvelopeMapperTest {

    record Quote(LocalDate eta, BigDecimal orderAmount) {}

    TaskEnvelopeMapper mapper = new TaskEnvelopeMapper(JsonMappers.wire());

    @Test
    @DisplayName("toWire(task) — type tag, snake_case payload, customer omitted for guests")
    void toWire_task() {
        Task<RecommendationRequest.ForCart> task = Task.of("sess_1", null,
                new RecommendationRequest.ForCart(List.of(StockLine.of("HAT-BLK", 2)), "apparel"));

        Map<String, Object> wire = mapper.toWire(task);

        assertThat(wire).containsEntry("type", TaskTypes.RECOMMEND_FOR_CART)
                .containsEntry("session_id", "sess_1")
                .doesNotContainKey("customer_id");
        assertThat(wire.get("payload")).isEqualTo(Map.of(
                "cart", List.of(Map.of("sku", "HAT-BLK", "qty", 2)),
                "preference_category", "apparel"));
    }

    @Test
    @DisplayName("toWire(result) — failure has empty payload, errors and next actions")
    void toWire_failedResult() {
        Task<PaymentRequest.Capture> task = Task.of("sess_1", "cust_001", new PaymentRequest.Capture("auth_x"));
        TaskResult<Object> result = TaskResult.failed(task,
                ErrorDetail.of(ErrorCodes.AUTH_NOT_FOUND, "Authorization not found", "auth_id", "auth_x"),
                NextAction.askCustomer("Retry payment"));

        Map<String, Object> wire = mapper.toWire(result);

        assertThat(wire).containsEntry("task_id", task.taskId())
                .containsEntry("status", "failed")
                .containsEntry("payload", Map.of());
        assertThat(mapper.toJson(wire)).contains("AUTH_NOT_FOUND", "ASK_CUSTOMER", "\"auth_id\" : \"auth_x\"");
    }

    @Test
    @DisplayName("toMap — dates are ISO-8601 and decimals stay exact")
    void toMap_isoDatesAndDecimals() {
        Map<String, Object> map = mapper.toMap(new Quote(LocalDate.of(2026, 3, 3), new BigDecimal("1598.50")));

        assertThat(map).containsEntry("eta", "2026-03-03");
        assertThat(new BigDecimal(map.get("order_amount").toString())).isEqualByComparingTo("1598.50");
    }
}
