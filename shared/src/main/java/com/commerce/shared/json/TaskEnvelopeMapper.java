package com.commerce.shared.json;

import com.commerce.shared.task.Task;
import com.commerce.shared.task.TaskResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders tasks and results in the language-neutral RPC shape:
 *
 *   request:  {task_id, type, session_id, customer_id?, payload}
 *   response: {task_id, status, payload, errors[], next_actions[]}
 */
public class TaskEnvelopeMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public TaskEnvelopeMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toWire(Task<?> task) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("task_id", task.taskId());
        envelope.put("type", task.type());
        envelope.put("session_id", task.sessionId());
        if (task.customerId() != null) {
            envelope.put("customer_id", task.customerId());
        }
        envelope.put("payload", toMap(task.request()));
        return envelope;
    }

    public Map<String, Object> toWire(TaskResult<?> result) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("task_id", result.taskId());
        envelope.put("status", result.status().wire());
        envelope.put("payload", result.payload() == null ? Map.of() : toMap(result.payload()));
        envelope.put("errors", objectMapper.convertValue(result.errors(), Object.class));
        envelope.put("next_actions", objectMapper.convertValue(result.nextActions(), Object.class));
        return envelope;
    }

    public Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
