package com.commerce.shared.task;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A request addressed to one component operation.
 *
 * @param taskId     unique id of this call
 * @param sessionId  checkout session that issued it
 * @param customerId customer on whose behalf it runs, may be null
 * @param request    typed operation payload
 */
public record Task<R extends TaskRequest>(String taskId, String sessionId, String customerId, R request) {

    public Task {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(request, "request");
    }

    public static <R extends TaskRequest> Task<R> of(String sessionId, String customerId, R request) {
        return new Task<>(UUID.randomUUID().toString(), sessionId, customerId, request);
    }

    public String type() {
        return request.type();
    }

    public Optional<String> customer() {
        return Optional.ofNullable(customerId);
    }
}
