package com.commerce.shared.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One structured error attached to a failed {@link TaskResult}.
 * Codes come from {@link ErrorCodes}; details are free-form diagnostics.
 */
public record ErrorDetail(String code, String message, Map<String, Object> details) {

    public ErrorDetail {
        Objects.requireNonNull(code, "code");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ErrorDetail of(String code, String message) {
        return new ErrorDetail(code, message, Map.of());
    }

    public static ErrorDetail of(String code, String message, Map<String, Object> details) {
        return new ErrorDetail(code, message, details);
    }

    /** Single-entry details map that tolerates a null value (e.g. a missing id). */
    public static ErrorDetail of(String code, String message, String key, Object value) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(key, value);
        return new ErrorDetail(code, message, details);
    }
}
