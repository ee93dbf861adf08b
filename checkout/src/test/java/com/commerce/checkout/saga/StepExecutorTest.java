package com.commerce.checkout.saga;

import com.commerce.shared.payment.PaymentRequest;
import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class StepExecutorTest {

    ExecutorService pool;
    StepExecutor executor;
    Task<PaymentRequest.Capture> task = Task.of("sess_1", null, new PaymentRequest.Capture("auth_1"));

    @BeforeEach
    void setUp() {
        pool = Executors.newSingleThreadExecutor();
        executor = new StepExecutor(Duration.ofMillis(200), pool);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("call — returns the collaborator's result unchanged")
    void call_passesResultThrough() {
        TaskResult<String> result = executor.call(SagaStep.CAPTURE_PAYMENT, task,
                () -> TaskResult.success(task, "captured"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload()).isEqualTo("captured");
    }

    @Test
    @DisplayName("call — runs on the step pool, not the caller's thread")
    void call_runsOnPool() {
        Thread caller = Thread.currentThread();

        TaskResult<Thread> result = executor.call(SagaStep.CAPTURE_PAYMENT, task,
                () -> TaskResult.success(task, Thread.currentThread()));

        assertThat(result.payload()).isNotSameAs(caller);
    }

    @Test
    @DisplayName("call — answer slower than the timeout becomes STEP_TIMEOUT")
    void call_timesOut() {
        TaskResult<String> result = executor.call(SagaStep.CAPTURE_PAYMENT, task, () -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TaskResult.success(task, "late");
        });

        assertThat(result.isFailed()).isTrue();
        assertThat(result.taskId()).isEqualTo(task.taskId());
        assertThat(result.firstErrorCode()).contains(ErrorCodes.STEP_TIMEOUT);
        assertThat(result.errors().get(0).details()).containsEntry("step", "CAPTURE_PAYMENT");
    }

    @Test
    @DisplayName("call — exception becomes COLLABORATOR_ERROR naming the exception type")
    void call_exception() {
        TaskResult<String> result = executor.call(SagaStep.CAPTURE_PAYMENT, task, () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(result.firstErrorCode()).contains(ErrorCodes.COLLABORATOR_ERROR);
        assertThat(result.errors().get(0).details())
                .containsEntry("exception", IllegalStateException.class.getName());
    }

    @Test
    @DisplayName("call — null result becomes COLLABORATOR_ERROR")
    void call_nullResult() {
        TaskResult<String> result = executor.call(SagaStep.CAPTURE_PAYMENT, task, () -> null);

        assertThat(result.firstErrorCode()).contains(ErrorCodes.COLLABORATOR_ERROR);
    }

    @Test
    @DisplayName("inline — runs on the caller's thread and maps exceptions")
    void inline_runsOnCaller() {
        Thread caller = Thread.currentThread();

        assertThat(executor.inline(SagaStep.RESERVE, task, () -> TaskResult.success(task, Thread.currentThread()))
                .payload()).isSameAs(caller);
        assertThat(executor.<String>inline(SagaStep.RESERVE, task, () -> {
            throw new IllegalArgumentException("bad");
        }).firstErrorCode()).contains(ErrorCodes.COLLABORATOR_ERROR);
    }
}
