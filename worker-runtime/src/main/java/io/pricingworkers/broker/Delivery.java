package io.pricingworkers.broker;

import io.pricingworkers.core.TaskEnvelope;

import java.util.Objects;

/**
 * One lease of an envelope. Every redelivery carries a fresh {@code leaseId}, so a consumer whose lease ran out
 * cannot settle the copy now held by someone else.
 */
public record Delivery(TaskEnvelope envelope, String leaseId) {

    public Delivery {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(leaseId, "leaseId");
    }

    public String taskId() { return envelope.taskId(); }
}
