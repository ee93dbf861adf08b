package com.commerce.checkout.saga;

import com.commerce.shared.task.TaskStatus;

import java.util.List;

/**
 * One entry of the saga log. Compensating actions are logged with
 * {@code compensation} set.
 */
public record StepRecord(SagaStep step, TaskStatus status, List<String> errorCodes, long durationMs,
                         boolean compensation) {

    public StepRecord {
        errorCodes = errorCodes == null ? List.of() : List.copyOf(errorCodes);
    }
}
