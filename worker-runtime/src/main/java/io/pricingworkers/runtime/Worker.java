package io.pricingworkers.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.pricingworkers.broker.Broker;
import io.pricingworkers.broker.BrokerUnavailableException;
import io.pricingworkers.broker.Delivery;
import io.pricingworkers.broker.ResultBackend;
import io.pricingworkers.core.InvalidPayloadException;
import io.pricingworkers.core.ResultRecord;
import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.DeadLetterSink;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.error.StageError;
import io.pricingworkers.metrics.Metrics;
import io.pricingworkers.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dequeue, run, report loop for one thread.
 *
 * <p>The result record is written before the envelope is acked. If the record cannot be written the lease is left
 * to expire and the envelope is delivered again; stages are idempotent so the duplicate run is harmless.
 *
 * <p>Follow-ups are enqueued one by one before the result is written. A broker outage part way through leaves the
 * earlier follow-ups queued and retries the whole envelope, which enqueues them again under new ids.
 */
public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final Broker broker;
    private final ResultBackend backend;
    private final StageRegistry stages;
    private final Set<TaskName> capabilities;
    private final RetryPolicy retryPolicy;
    private final DeadLetterSink deadLetters;
    private final Metrics metrics;
    private final Clock clock;
    private final Duration pollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final Meter dequeued;
    private final Meter succeeded;
    private final Meter failed;
    private final Meter retried;
    private final Meter errors;

    public Worker(String name,
                  Broker broker,
                  ResultBackend backend,
                  StageRegistry stages,
                  Set<TaskName> capabilities,
                  RetryPolicy retryPolicy,
                  DeadLetterSink deadLetters,
                  Metrics metrics,
                  Clock clock,
                  Duration pollInterval) {
        this.name = name;
        this.broker = broker;
        this.backend = backend;
        this.stages = stages;
        this.capabilities = stages.supported(capabilities);
        this.retryPolicy = retryPolicy;
        this.deadLetters = deadLetters == null ? DeadLetterSink.noop() : deadLetters;
        this.metrics = metrics;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.dequeued = metrics.meter(Metrics.DEQUEUED);
        this.succeeded = metrics.meter(Metrics.SUCCEEDED);
        this.failed = metrics.meter(Metrics.FAILED);
        this.retried = metrics.meter(Metrics.RETRIED);
        this.errors = metrics.meter(Metrics.WORKER_ERRORS);
    }

    public String name() { return name; }
    public Set<TaskName> capabilities() { return capabilities; }
    public boolean isBusy() { return busy.get(); }
    public boolean isRunning() { return running.get(); }

    /** Asks the loop to exit after the in-flight envelope, if any, is finished. */
    public void stop() { running.set(false); }

    @Override
    public void run() {
        running.set(true);
        log.info("{} started capabilities={}", name, capabilities);
        int unavailable = 0;
        while (running.get() && !broker.isClosed()) {
            Optional<Delivery> next;
            try {
                next = broker.dequeue(capabilities, pollInterval);
                unavailable = 0;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            } catch (BrokerUnavailableException e) {
                unavailable++;
                long backoff = retryPolicy.backoffMillis(unavailable);
                log.warn("{} broker unavailable, backing off {}ms: {}", name, backoff, e.getMessage());
                if (!sleep(backoff)) break;
                continue;
            }
            if (next.isEmpty()) continue;
            busy.set(true);
            try {
                process(next.get());
            } catch (RuntimeException e) {
                errors.mark();
                log.error("{} could not settle task={} id={}, leaving lease to expire", name,
                        next.get().envelope().taskName(), next.get().taskId(), e);
            } finally {
                busy.set(false);
            }
        }
        running.set(false);
        log.info("{} stopped", name);
    }

    /** Runs one delivery through its stage and settles it with the broker and backend. */
    public void process(Delivery delivery) {
        TaskEnvelope env = delivery.envelope();
        dequeued.mark();
        MDC.put("taskId", env.taskId());
        try {
            String ticker = env.view().optString("ticker").orElse("-");
            log.info("running task={} id={} ticker={} retry={}", env.taskName(), env.taskId(), ticker, env.retryCount());
            StageResult result = execute(env);
            if (result.isSuccess()) {
                onSuccess(delivery, result);
            } else {
                onFailure(delivery, result.error());
            }
        } finally {
            MDC.remove("taskId");
        }
    }

    private StageResult execute(TaskEnvelope env) {
        Optional<Stage> stage = stages.get(env.taskName());
        if (stage.isEmpty()) {
            return StageResult.failure(StageError.of(ErrorKind.VALIDATION, "UnsupportedTask", "no stage registered for " + env.taskName()));
        }
        try {
            env.validate();
        } catch (InvalidPayloadException e) {
            return StageResult.failure(StageError.of(ErrorKind.VALIDATION, "InvalidPayload", e.getMessage()));
        }
        try (Timer.Context ignored = metrics.stageTimer(env.taskName().wireName()).time()) {
            StageResult r = stage.get().execute(new StageContext(env, clock));
            return r == null ? StageResult.success() : r;
        } catch (RuntimeException e) {
            log.error("task={} id={} raised", env.taskName(), env.taskId(), e);
            return StageResult.failure(StageError.fromException(e));
        }
    }

    private void onSuccess(Delivery delivery, StageResult result) {
        TaskEnvelope env = delivery.envelope();
        try {
            for (TaskEnvelope f : result.followUps()) {
                broker.enqueue(f);
                log.info("chained task={} id={} parent={}", f.taskName(), f.taskId(), env.taskId());
            }
        } catch (InvalidPayloadException e) {
            onFailure(delivery, StageError.of(ErrorKind.VALIDATION, "InvalidFollowUp", e.getMessage()));
            return;
        } catch (BrokerUnavailableException e) {
            onFailure(delivery, new StageError(ErrorKind.TRANSIENT_INFRA, "BrokerUnavailable", e.getMessage(), null, null));
            return;
        }
        try {
            backend.record(ResultRecord.success(env, result.resultRef(), result.summary(), clock.instant()));
            if (!broker.ack(delivery)) {
                log.warn("lease for task={} id={} was lost before ack, result kept", env.taskName(), env.taskId());
            }
            succeeded.mark();
            log.info("succeeded task={} id={} ref={}", env.taskName(), env.taskId(), result.resultRef());
        } catch (BrokerUnavailableException e) {
            log.error("could not settle task={} id={}, leaving lease to expire: {}", env.taskName(), env.taskId(), e.getMessage());
        }
    }

    private void onFailure(Delivery delivery, StageError error) {
        TaskEnvelope env = delivery.envelope();
        try {
            if (retryPolicy.shouldRetry(env.retryCount(), error.kind())) {
                long backoff = retryPolicy.backoffMillis(env.retryCount() + 1);
                backend.record(ResultRecord.retrying(env, error, clock.instant()));
                broker.nack(delivery, true, Duration.ofMillis(backoff));
                retried.mark();
                log.warn("retrying task={} id={} in {}ms after {}/{}: {}", env.taskName(), env.taskId(), backoff, error.kind(), error.code(), error.message());
            } else if (softWaitApplies(env, error)) {
                backend.record(ResultRecord.retrying(env, error, clock.instant()));
                broker.nack(delivery, true, error.softWait());
                retried.mark();
                log.info("waiting {} for data, requeued task={} id={}: {}", error.softWait(), env.taskName(), env.taskId(), error.message());
            } else {
                backend.record(ResultRecord.failed(env, error, clock.instant()));
                deadLetters.acceptFailure(env.taskName().wireName(), env, error);
                broker.nack(delivery, false);
                failed.mark();
                log.error("failed task={} id={} {}/{}: {}", env.taskName(), env.taskId(), error.kind(), error.code(), error.message());
            }
        } catch (BrokerUnavailableException e) {
            log.error("could not settle failed task={} id={}, leaving lease to expire: {}", env.taskName(), env.taskId(), e.getMessage());
        }
    }

    /** A data-unavailable error asking for a soft wait is requeued on its first delivery only. */
    private static boolean softWaitApplies(TaskEnvelope env, StageError error) {
        return error.kind() == ErrorKind.DATA_UNAVAILABLE && error.softWait() != null && env.retryCount() == 0;
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
