package com.commerce.checkout.saga;

import com.commerce.shared.task.TaskResult;

import java.util.function.Supplier;

/**
 * Undo action pushed by a completed step.
 *
 * @param step        the step being undone
 * @param description human-readable summary, e.g. "release res_order_1_..."
 * @param action      runs the undo and reports its outcome
 */
public record Compensation(SagaStep step, String description, Supplier<TaskResult<?>> action) {
}
