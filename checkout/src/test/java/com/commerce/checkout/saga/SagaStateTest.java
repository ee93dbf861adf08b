package com.commerce.checkout.saga;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class SagaStateTest {

    SagaState state = new SagaState("sess_1", "order_1", Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    @DisplayName("compensations — popped newest first")
    void compensations_lifo() {
        state.pushCompensation(new Compensation(SagaStep.RESERVE, "release res_1", () -> null));
        state.pushCompensation(new Compensation(SagaStep.AUTHORIZE_PAYMENT, "refund tx_1", () -> null));

        assertThat(state.pendingCompensations()).containsExactly("refund tx_1", "release res_1");
        assertThat(state.popCompensation().orElseThrow().step()).isEqualTo(SagaStep.AUTHORIZE_PAYMENT);
        assertThat(state.popCompensation().orElseThrow().step()).isEqualTo(SagaStep.RESERVE);
        assertThat(state.popCompensation()).isEmpty();
        assertThat(state.hasPendingCompensations()).isFalse();
    }

    @Test
    @DisplayName("payloads — keyed by step payload key in step order")
    void payloads_inStepOrder() {
        state.putPayload(SagaStep.AUTHORIZE_PAYMENT, "auth");
        state.putPayload(SagaStep.CHECK_INVENTORY, "report");

        assertThat(state.payloadsByKey()).containsExactly(
                entry("inventory", "report"), entry("authorization", "auth"));
        assertThat(state.payload(SagaStep.CHECK_INVENTORY, String.class)).contains("report");
        assertThat(state.payload(SagaStep.CHECK_INVENTORY, Integer.class)).isEmpty();
    }

    @Test
    @DisplayName("finish — records terminal status and instant")
    void finish() {
        Instant end = Instant.parse("2026-03-01T10:00:01Z");
        state.finish(SagaState.Status.COMPLETED, end);

        assertThat(state.getStatus()).isEqualTo(SagaState.Status.COMPLETED);
        assertThat(state.getFinishedAt()).isEqualTo(end);
        assertThat(state.getLog()).isEmpty();
    }
}
