package io.pricingworkers.broker;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local broker. Ready envelopes are kept in arrival order; leased ones move to the in-flight table until
 * acked, nacked or expired, and go back to their original position when redelivered or requeued.
 */
public class InMemoryBroker implements Broker {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);
    private static final long MAX_WAIT_SLICE_MILLIS = 50;

    private final Duration visibilityTimeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final TreeMap<Long, TaskEnvelope> ready = new TreeMap<>();
    private final Map<String, Long> positions = new HashMap<>();
    private final Map<String, Lease> inflight = new HashMap<>();
    private long nextPosition;
    private final Map<String, String> heldLanes = new HashMap<>();
    private volatile boolean closed;

    public InMemoryBroker(Duration visibilityTimeout, Clock clock) {
        this.visibilityTimeout = visibilityTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public String enqueue(TaskEnvelope envelope) throws BrokerUnavailableException {
        envelope.validate();
        lock.lock();
        try {
            if (closed) throw new BrokerUnavailableException("broker closed");
            Long pos = positions.computeIfAbsent(envelope.taskId(), id -> nextPosition++);
            ready.put(pos, envelope);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("enqueued task={} id={} lane={}", envelope.taskName(), envelope.taskId(), envelope.lane());
        return envelope.taskId();
    }

    @Override
    public Optional<Delivery> dequeue(Set<TaskName> capabilities, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        lock.lock();
        try {
            while (!closed) {
                Instant now = clock.instant();
                reclaimExpired(now);
                Delivery next = takeFirstMatching(capabilities, now);
                if (next != null) return Optional.of(next);
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return Optional.empty();
                changed.await(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(MAX_WAIT_SLICE_MILLIS)), TimeUnit.NANOSECONDS);
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private Delivery takeFirstMatching(Set<TaskName> capabilities, Instant now) {
        Iterator<Map.Entry<Long, TaskEnvelope>> it = ready.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, TaskEnvelope> entry = it.next();
            TaskEnvelope e = entry.getValue();
            if (!capabilities.contains(e.taskName()) || !e.isDue(now)) continue;
            if (e.lane() != null && heldLanes.containsKey(e.lane())) continue;
            it.remove();
            Delivery d = new Delivery(e, UUID.randomUUID().toString());
            inflight.put(e.taskId(), new Lease(d, entry.getKey(), now.plus(visibilityTimeout)));
            if (e.lane() != null) heldLanes.put(e.lane(), d.leaseId());
            return d;
        }
        return null;
    }

    private void reclaimExpired(Instant now) {
        Iterator<Lease> it = inflight.values().iterator();
        while (it.hasNext()) {
            Lease l = it.next();
            if (now.isBefore(l.deadline)) continue;
            it.remove();
            releaseLane(l.delivery);
            TaskEnvelope e = l.delivery.envelope();
            ready.put(l.position, e);
            log.warn("lease expired, redelivering task={} id={} retry={}", e.taskName(), e.taskId(), e.retryCount());
        }
    }

    private void releaseLane(Delivery d) {
        String lane = d.envelope().lane();
        if (lane != null) heldLanes.remove(lane, d.leaseId());
    }

    /** Removes and returns the lease if {@code d} is still the current one. */
    private Lease settle(Delivery d) {
        Lease l = inflight.get(d.taskId());
        if (l == null || !l.delivery.leaseId().equals(d.leaseId())) {
            log.debug("ignoring stale lease task={} id={}", d.envelope().taskName(), d.taskId());
            return null;
        }
        inflight.remove(d.taskId());
        releaseLane(l.delivery);
        return l;
    }

    @Override
    public boolean ack(Delivery delivery) {
        lock.lock();
        try {
            Lease l = settle(delivery);
            if (l == null) return false;
            forget(l);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean nack(Delivery delivery, boolean requeue, Duration delay) {
        lock.lock();
        try {
            Lease l = settle(delivery);
            if (l == null) return false;
            if (requeue) {
                ready.put(l.position, l.delivery.envelope().requeued(clock.instant(), delay));
            } else {
                forget(l);
            }
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void forget(Lease l) {
        if (!ready.containsKey(l.position)) positions.remove(l.delivery.taskId());
    }

    @Override
    public boolean ping() { return !closed; }

    @Override
    public int depth() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int inflight() {
        lock.lock();
        try {
            return inflight.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() { return closed; }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private record Lease(Delivery delivery, long position, Instant deadline) {}
}
