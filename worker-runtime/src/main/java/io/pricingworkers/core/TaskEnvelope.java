package io.pricingworkers.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Serializable unit of work: a named operation, its payload and the routing metadata brokers need.
 *
 * @param lane         single-writer lane (the ticker for ticker-publishing tasks), or null
 * @param notBefore    earliest delivery time for delayed requeues, or null
 * @param parentTaskId task whose completion chained this one, or null
 */
public record TaskEnvelope(TaskName taskName,
                           String taskId,
                           Map<String, Object> payload,
                           Instant enqueuedAt,
                           int retryCount,
                           String lane,
                           Instant notBefore,
                           String parentTaskId) {

    public TaskEnvelope {
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (payload != null) payload.forEach((k, v) -> { if (k != null && v != null) copy.put(k, v); });
        payload = java.util.Collections.unmodifiableMap(copy);
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
    }

    public static TaskEnvelope create(TaskName taskName, Map<String, Object> payload, Instant now) {
        return create(taskName, payload, now, null);
    }

    public static TaskEnvelope create(TaskName taskName, Map<String, Object> payload, Instant now, String parentTaskId) {
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        String lane = null;
        if (taskName.tickerLane() && copy.get("ticker") != null) {
            lane = String.valueOf(copy.get("ticker")).trim().toUpperCase(java.util.Locale.ROOT);
        }
        return new TaskEnvelope(taskName, UUID.randomUUID().toString(), copy, now, 0, lane, null, parentTaskId);
    }

    /** Checks the payload against the operation's schema; throws {@link InvalidPayloadException}. */
    public void validate() {
        taskName.schema().validate(taskName, payload);
    }

    public TaskEnvelope requeued(Instant now, Duration delay) {
        Instant due = (delay == null || delay.isZero() || delay.isNegative()) ? null : now.plus(delay);
        return new TaskEnvelope(taskName, taskId, payload, enqueuedAt, retryCount + 1, lane, due, parentTaskId);
    }

    @JsonIgnore
    public TaskPayload view() { return new TaskPayload(payload); }

    @JsonIgnore
    public boolean isDue(Instant now) { return notBefore == null || !notBefore.isAfter(now); }
}
