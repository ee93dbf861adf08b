package com.commerce.shared.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Advisory follow-up suggested by a component. Nothing is obliged to act on it.
 */
public record NextAction(Type type, String message, Map<String, Object> data) {

    public enum Type {
        ASK_CUSTOMER,
        CALL_COMPONENT,
        NOTIFY_CUSTOMER,
        MANUAL_INTERVENTION
    }

    public NextAction {
        Objects.requireNonNull(type, "type");
        data = data == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static NextAction askCustomer(String message) {
        return new NextAction(Type.ASK_CUSTOMER, message, Map.of());
    }

    public static NextAction notifyCustomer(String message) {
        return new NextAction(Type.NOTIFY_CUSTOMER, message, Map.of());
    }

    public static NextAction callComponent(String component, String message, Map<String, Object> data) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("component", component);
        if (data != null) {
            merged.putAll(data);
        }
        return new NextAction(Type.CALL_COMPONENT, message, merged);
    }
}
