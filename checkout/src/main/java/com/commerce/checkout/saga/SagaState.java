package com.commerce.checkout.saga;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one checkout call. Confined to the calling thread and dropped
 * when the call returns.
 */
@Getter
public class SagaState {

    public enum Status {
        RUNNING,
        COMPENSATING,
        COMPLETED,
        PENDING,
        FAILED
    }

    private final String sessionId;
    private final String orderId;
    private final Instant startedAt;

    @Setter
    private Status status = Status.RUNNING;
    private Instant finishedAt;
    private boolean compensated;

    private final List<StepRecord> log = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Deque<Compensation> compensations = new ArrayDeque<>();
    @Getter(AccessLevel.NONE)
    private final Map<SagaStep, Object> payloads = new EnumMap<>(SagaStep.class);

    public SagaState(String sessionId, String orderId, Instant startedAt) {
        this.sessionId = sessionId;
        this.orderId = orderId;
        this.startedAt = startedAt;
    }

    public void record(StepRecord record) {
        log.add(record);
    }

    public void putPayload(SagaStep step, Object payload) {
        payloads.put(step, payload);
    }

    public void pushCompensation(Compensation compensation) {
        compensations.push(compensation);
    }

    /** Newest first. */
    public Optional<Compensation> popCompensation() {
        return Optional.ofNullable(compensations.poll());
    }

    public boolean hasPendingCompensations() {
        return !compensations.isEmpty();
    }

    public List<String> pendingCompensations() {
        return compensations.stream().map(Compensation::description).toList();
    }

    public void markCompensated() {
        this.compensated = true;
    }

    public void finish(Status terminal, Instant at) {
        this.status = terminal;
        this.finishedAt = at;
    }

    public List<StepRecord> getLog() {
        return Collections.unmodifiableList(log);
    }

    /** Step payloads keyed by {@link SagaStep#payloadKey()}, in step order. */
    public Map<String, Object> payloadsByKey() {
        Map<String, Object> byKey = new LinkedHashMap<>();
        payloads.forEach((step, payload) -> byKey.put(step.payloadKey(), payload));
        return byKey;
    }

    public <T> Optional<T> payload(SagaStep step, Class<T> type) {
        return Optional.ofNullable(payloads.get(step)).filter(type::isInstance).map(type::cast);
    }
}
