package com.commerce.checkout.model;

import com.commerce.checkout.saga.FailureReason;
import com.commerce.checkout.saga.SagaStep;
import com.commerce.checkout.saga.StepRecord;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.NextAction;
import com.commerce.shared.task.TaskStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal outcome of one checkout call.
 *
 * @param reason      set only when {@code status} is FAILED
 * @param detail      collaborator errors verbatim, followed by any compensation errors
 * @param payloads    step payloads keyed by {@link SagaStep#payloadKey()}
 * @param compensated whether the compensation stack was unwound
 */
public record CheckoutResult(TaskStatus status,
                             String orderId,
                             String sessionId,
                             FailureReason reason,
                             List<ErrorDetail> detail,
                             List<NextAction> nextActions,
                             Map<String, Object> payloads,
                             List<StepRecord> steps,
                             boolean compensated) {

    public CheckoutResult {
        Objects.requireNonNull(status, "status");
        detail = detail == null ? List.of() : List.copyOf(detail);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
        payloads = payloads == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payloads));
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    public boolean isPending() {
        return status == TaskStatus.PENDING;
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }

    public <T> Optional<T> payload(SagaStep step, Class<T> type) {
        return Optional.ofNullable(payloads.get(step.payloadKey())).filter(type::isInstance).map(type::cast);
    }

    /**
     * Wire shape: {@code status}, then {@code order_id} (success, pending) or
     * {@code reason} (failed), {@code detail}, {@code next_actions} and the step payloads.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("status", status);
        if (isFailed()) {
            wire.put("reason", reason);
        } else {
            wire.put("order_id", orderId);
        }
        wire.put("detail", detail);
        wire.put("next_actions", nextActions);
        wire.putAll(payloads);
        return wire;
    }
}
