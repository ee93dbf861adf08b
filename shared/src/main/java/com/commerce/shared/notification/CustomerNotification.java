package com.commerce.shared.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * @param channel    "email" or "sms"
 * @param templateId one of the {@code TEMPLATE_*} constants of {@link CustomerNotifier}
 */
public record CustomerNotification(String customerId, String channel, String templateId,
                                   Map<String, Object> variables) {

    public CustomerNotification {
        Objects.requireNonNull(customerId, "customerId");
        Objects.requireNonNull(templateId, "templateId");
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
