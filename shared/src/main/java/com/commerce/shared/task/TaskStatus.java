package com.commerce.shared.task;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single task, and of a whole checkout.
 */
public enum TaskStatus {
    SUCCESS,
    FAILED,
    PENDING;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
