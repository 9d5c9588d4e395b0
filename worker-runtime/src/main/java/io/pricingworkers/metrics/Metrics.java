package io.pricingworkers.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

public class Metrics {
    public static final String DEQUEUED = "worker.dequeued";
    public static final String SUCCEEDED = "worker.succeeded";
    public static final String FAILED = "worker.failed";
    public static final String RETRIED = "worker.retried";
    public static final String WORKER_ERRORS = "worker.errors";
    public static final String CACHE_DEGRADED = "store.cache.degraded";
    public static final String BROKER_DEPTH = "broker.depth";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public Timer stageTimer(String taskName) { return registry.timer("stage." + taskName + ".time"); }

    /** Registers the gauge once; later registrations under the same name are ignored. */
    public <T> void gauge(String name, Supplier<T> value) {
        if (registry.getGauges().containsKey(name)) return;
        registry.register(name, (Gauge<T>) value::get);
    }

    /** Counts of every meter and counter, keyed by name, for exit summaries. */
    public Map<String, Long> snapshot() {
        Map<String, Long> out = new TreeMap<>();
        registry.getMeters().forEach((k, m) -> out.put(k, m.getCount()));
        registry.getCounters().forEach((k, c) -> out.put(k, c.getCount()));
        registry.getTimers().forEach((k, t) -> out.put(k, t.getCount()));
        return out;
    }

    public static Metrics standalone() { return new Metrics(new MetricRegistry()); }
}
