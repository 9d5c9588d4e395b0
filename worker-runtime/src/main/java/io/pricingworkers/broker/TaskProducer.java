package io.pricingworkers.broker;

import io.pricingworkers.core.ResultRecord;
import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Builds envelopes and enqueues them, retrying with backoff while the broker is unreachable.
 */
public class TaskProducer {
    private static final Logger log = LoggerFactory.getLogger(TaskProducer.class);

    private final Broker broker;
    private final ResultBackend backend;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public TaskProducer(Broker broker, ResultBackend backend, RetryPolicy retryPolicy, Clock clock) {
        this.broker = broker;
        this.backend = backend;
        this.retryPolicy = retryPolicy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public String submit(TaskName taskName, Map<String, Object> payload) throws BrokerUnavailableException, InterruptedException {
        return submit(TaskEnvelope.create(taskName, payload, clock.instant()));
    }

    /**
     * @throws io.pricingworkers.core.InvalidPayloadException immediately, without retrying
     * @throws BrokerUnavailableException once the retry budget is spent
     */
    public String submit(TaskEnvelope envelope) throws BrokerUnavailableException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                String id = broker.enqueue(envelope);
                log.info("submitted task={} id={} payload={}", envelope.taskName(), id, envelope.view());
                return id;
            } catch (BrokerUnavailableException e) {
                attempt++;
                if (attempt > retryPolicy.maxRetries()) throw e;
                long backoff = retryPolicy.backoffMillis(attempt);
                log.warn("broker unavailable, retry {}/{} in {}ms: {}", attempt, retryPolicy.maxRetries(), backoff, e.getMessage());
                Thread.sleep(backoff);
            }
        }
    }

    public Optional<ResultRecord> awaitResult(String taskId, Duration timeout) throws BrokerUnavailableException, InterruptedException {
        return backend.await(taskId, timeout);
    }
}
