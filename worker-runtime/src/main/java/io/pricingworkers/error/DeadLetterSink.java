package io.pricingworkers.error;

import io.pricingworkers.core.TaskEnvelope;

/**
 * Receives envelopes that reached a terminal failure.
 */
public interface DeadLetterSink extends AutoCloseable {
    void acceptFailure(String stage, TaskEnvelope envelope, StageError error);

    @Override default void close() {}

    static DeadLetterSink noop() { return (stage, envelope, error) -> {}; }
}
