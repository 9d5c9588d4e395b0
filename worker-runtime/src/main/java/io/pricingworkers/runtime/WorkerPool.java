package io.pricingworkers.runtime;

import io.pricingworkers.broker.Broker;
import io.pricingworkers.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a fixed set of {@link Worker}s on their own threads against one broker. Resources handed to the pool, such
 * as executors used by stages, are closed once the workers have stopped.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final Broker broker;
    private final List<Worker> workers;
    private final List<AutoCloseable> resources;
    private final List<Thread> threads = new ArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public WorkerPool(Broker broker, List<Worker> workers, Metrics metrics) {
        this(broker, workers, Set.of(), metrics);
    }

    public WorkerPool(Broker broker, List<Worker> workers, Set<AutoCloseable> resources, Metrics metrics) {
        this.broker = Objects.requireNonNull(broker);
        this.workers = List.copyOf(workers);
        this.resources = List.copyOf(resources);
        if (this.workers.isEmpty()) throw new IllegalArgumentException("worker pool needs at least one worker");
        metrics.gauge(Metrics.BROKER_DEPTH, broker::depth);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        for (Worker w : workers) {
            Thread t = new Thread(w, w.name());
            t.setDaemon(false);
            threads.add(t);
            t.start();
        }
        log.info("worker pool started with {} workers", workers.size());
    }

    /** Lets in-flight envelopes finish, then waits up to {@code grace} for every thread to exit. */
    public void stop(Duration grace) {
        if (!running.compareAndSet(true, false)) return;
        workers.forEach(Worker::stop);
        long deadline = System.nanoTime() + grace.toNanos();
        for (Thread t : threads) {
            long remaining = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            try {
                t.join(remaining);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
            if (t.isAlive()) log.warn("{} still busy after grace period", t.getName());
        }
        for (AutoCloseable r : resources) {
            try {
                r.close();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("interrupted while closing {}", r);
            } catch (Exception e) {
                log.warn("closing {} failed: {}", r, e.getMessage());
            }
        }
        log.info("worker pool stopped");
    }

    /**
     * Waits until the broker has nothing ready or leased and no worker is busy, observed twice in a row.
     *
     * @return false on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        int quiet = 0;
        while (System.nanoTime() < deadline) {
            boolean idle = broker.depth() == 0 && broker.inflight() == 0 && workers.stream().noneMatch(Worker::isBusy);
            quiet = idle ? quiet + 1 : 0;
            if (quiet >= 2) return true;
            Thread.sleep(25);
        }
        return false;
    }

    public boolean isRunning() { return running.get(); }

    public List<Worker> workers() { return workers; }

    @Override
    public void close() { stop(Duration.ofSeconds(10)); }
}
