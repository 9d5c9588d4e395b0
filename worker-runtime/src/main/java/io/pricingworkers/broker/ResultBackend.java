package io.pricingworkers.broker;

import io.pricingworkers.core.ResultRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * Backend channel: per-task result records keyed by task id.
 */
public interface ResultBackend extends AutoCloseable {

    /** Upserts by task id. A terminal record is never replaced by a RETRYING one. */
    void record(ResultRecord result) throws BrokerUnavailableException;

    Optional<ResultRecord> find(String taskId) throws BrokerUnavailableException;

    /** Polls until a terminal record exists or the timeout elapses. */
    default Optional<ResultRecord> await(String taskId, Duration timeout) throws BrokerUnavailableException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Optional<ResultRecord> r = find(taskId);
            if (r.isPresent() && r.get().status().terminal()) return r;
            if (System.nanoTime() >= deadline) return Optional.empty();
            Thread.sleep(20);
        }
    }

    boolean ping();

    @Override
    default void close() {}
}
