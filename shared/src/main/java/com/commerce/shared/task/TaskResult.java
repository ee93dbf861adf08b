package com.commerce.shared.task;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Response to a {@link Task}.
 *
 * The payload is present on success and pending outcomes; errors are present
 * on failure. Next actions are advisory and may accompany any status.
 */
public record TaskResult<T>(String taskId,
                            TaskStatus status,
                            T payload,
                            List<ErrorDetail> errors,
                            List<NextAction> nextActions) {

    public TaskResult {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        errors = errors == null ? List.of() : List.copyOf(errors);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
    }

    // ─── Factories ────────────────────────────────────────────────────────────

    public static <T> TaskResult<T> success(Task<?> task, T payload) {
        return new TaskResult<>(task.taskId(), TaskStatus.SUCCESS, payload, List.of(), List.of());
    }

    public static <T> TaskResult<T> success(Task<?> task, T payload, List<NextAction> nextActions) {
        return new TaskResult<>(task.taskId(), TaskStatus.SUCCESS, payload, List.of(), nextActions);
    }

    public static <T> TaskResult<T> pending(Task<?> task, T payload, List<NextAction> nextActions) {
        return new TaskResult<>(task.taskId(), TaskStatus.PENDING, payload, List.of(), nextActions);
    }

    public static <T> TaskResult<T> failed(Task<?> task, ErrorDetail error, NextAction... nextActions) {
        return failed(task.taskId(), error, nextActions);
    }

    public static <T> TaskResult<T> failed(String taskId, ErrorDetail error, NextAction... nextActions) {
        return new TaskResult<>(taskId, TaskStatus.FAILED, null, List.of(error), List.of(nextActions));
    }

    /** Failure that still reports what was observed, e.g. a negative availability check. */
    public static <T> TaskResult<T> failedWithPayload(Task<?> task, T payload, List<ErrorDetail> errors,
                                                      List<NextAction> nextActions) {
        return new TaskResult<>(task.taskId(), TaskStatus.FAILED, payload, errors, nextActions);
    }

    // ─── Queries ──────────────────────────────────────────────────────────────

    @JsonIgnore
    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == TaskStatus.PENDING;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }

    @JsonIgnore
    public Optional<T> payloadIfPresent() {
        return Optional.ofNullable(payload);
    }

    @JsonIgnore
    public Optional<String> firstErrorCode() {
        return errors.stream().map(ErrorDetail::code).findFirst();
    }
}
