package io.pricingworkers.broker;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Broker channel: durable-ish queue of task envelopes with leases.
 *
 * <p>A dequeued envelope is leased to the caller until {@link #ack}, {@link #nack} or the visibility timeout,
 * after which it is delivered again with its retry count unchanged and a new lease id. Settling a lease that is no
 * longer current does nothing. Envelopes that share a lane are never leased concurrently.
 */
public interface Broker extends AutoCloseable {

    /**
     * Validates and enqueues the envelope.
     *
     * @return the task id
     * @throws io.pricingworkers.core.InvalidPayloadException if the payload does not match the operation's schema
     */
    String enqueue(TaskEnvelope envelope) throws BrokerUnavailableException;

    /** Blocks until an envelope whose task name is in {@code capabilities} is available, or the broker closes. */
    default Optional<Delivery> dequeue(Set<TaskName> capabilities) throws BrokerUnavailableException, InterruptedException {
        while (!isClosed()) {
            Optional<Delivery> next = dequeue(capabilities, Duration.ofSeconds(1));
            if (next.isPresent()) return next;
        }
        return Optional.empty();
    }

    Optional<Delivery> dequeue(Set<TaskName> capabilities, Duration timeout) throws BrokerUnavailableException, InterruptedException;

    /**
     * Completes the lease.
     *
     * @return false if the delivery is no longer the current lease (already settled, or redelivered elsewhere)
     */
    boolean ack(Delivery delivery) throws BrokerUnavailableException;

    default boolean nack(Delivery delivery, boolean requeue) throws BrokerUnavailableException {
        return nack(delivery, requeue, Duration.ZERO);
    }

    /**
     * Releases the lease. With {@code requeue} a copy with {@code retryCount+1} becomes available after
     * {@code delay}; otherwise the envelope is dropped. A stale delivery is ignored and false is returned.
     */
    boolean nack(Delivery delivery, boolean requeue, Duration delay) throws BrokerUnavailableException;

    boolean ping();

    /** Envelopes waiting to be leased. */
    int depth();

    /** Envelopes currently leased to a worker. */
    int inflight();

    boolean isClosed();

    @Override
    void close();
}
