package io.pricingworkers.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache held in process memory, one instance per numbered namespace. Expired entries are dropped lazily
 * on read.
 */
public class InMemoryKeyValueCache implements KeyValueCache {
    private final int namespace;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemoryKeyValueCache(int namespace, Clock clock) {
        this.namespace = namespace;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (e.expiresAt != null && !clock.instant().isBefore(e.expiresAt)) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value.clone());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        Instant exp = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : clock.instant().plus(ttl);
        entries.put(key, new Entry(value.clone(), exp));
    }

    @Override
    public void delete(String key) { entries.remove(key); }

    @Override
    public int namespace() { return namespace; }

    public int size() { return entries.size(); }

    private record Entry(byte[] value, Instant expiresAt) {}
}
