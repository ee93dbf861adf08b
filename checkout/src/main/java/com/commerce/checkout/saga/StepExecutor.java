package com.commerce.checkout.saga;

import com.commerce.shared.task.ErrorCodes;
import com.commerce.shared.task.ErrorDetail;
import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a single collaborator call and always returns a {@link TaskResult}.
 *
 * A timeout becomes {@code STEP_TIMEOUT}; an exception or a null result
 * becomes {@code COLLABORATOR_ERROR}. Nothing is retried.
 */
@Slf4j
public class StepExecutor {

    private final TimeLimiter timeLimiter;
    private final ExecutorService executor;
    private final Duration timeout;

    public StepExecutor(Duration timeout, ExecutorService executor) {
        this.timeout = timeout;
        this.executor = executor;
        this.timeLimiter = TimeLimiter.of("checkout-step", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }

    /** Runs {@code call} on the step pool, bounded by the step timeout. */
    public <T> TaskResult<T> call(SagaStep step, Task<?> task, Supplier<TaskResult<T>> call) {
        try {
            TaskResult<T> result = timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(call, executor));
            return orError(step, task, result);
        } catch (TimeoutException ex) {
            log.warn("Step timed out: step={}, taskId={}, timeout={}", step, task.taskId(), timeout);
            return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.STEP_TIMEOUT,
                    step + " did not answer within " + timeout, details(step, null)));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return collaboratorError(step, task, ex);
        } catch (Exception ex) {
            return collaboratorError(step, task, ex);
        }
    }

    /** Runs {@code call} on the caller's thread, for in-process ledger calls. */
    public <T> TaskResult<T> inline(SagaStep step, Task<?> task, Supplier<TaskResult<T>> call) {
        try {
            return orError(step, task, call.get());
        } catch (RuntimeException ex) {
            return collaboratorError(step, task, ex);
        }
    }

    private <T> TaskResult<T> orError(SagaStep step, Task<?> task, TaskResult<T> result) {
        if (result != null) {
            return result;
        }
        log.error("Step returned no result: step={}, taskId={}", step, task.taskId());
        return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.COLLABORATOR_ERROR,
                step + " returned no result", details(step, null)));
    }

    private <T> TaskResult<T> collaboratorError(SagaStep step, Task<?> task, Exception ex) {
        log.error("Step raised: step={}, taskId={}, error={}", step, task.taskId(), ex.toString(), ex);
        return TaskResult.failed(task, ErrorDetail.of(ErrorCodes.COLLABORATOR_ERROR,
                step + " failed: " + ex.getMessage(), details(step, ex)));
    }

    private static Map<String, Object> details(SagaStep step, Exception ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("step", step.name());
        if (ex != null) {
            details.put("exception", ex.getClass().getName());
        }
        return details;
    }
}
