package io.pricingworkers.runtime;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

public final class StageContext {
    private final TaskEnvelope envelope;
    private final TaskPayload payload;
    private final Clock clock;

    public StageContext(TaskEnvelope envelope, Clock clock) {
        this.envelope = envelope;
        this.payload = envelope.view();
        this.clock = clock;
    }

    public TaskEnvelope envelope() { return envelope; }
    public TaskPayload payload() { return payload; }
    public Clock clock() { return clock; }
    public Instant now() { return clock.instant(); }

    /** New envelope chained to the current one. */
    public TaskEnvelope followUp(TaskName taskName, Map<String, Object> payload) {
        return TaskEnvelope.create(taskName, payload, clock.instant(), envelope.taskId());
    }
}
