package io.pricingworkers.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local durable tier for tests and dry runs.
 */
public class InMemoryObjectStore implements ObjectStore {
    private final Map<String, ConcurrentSkipListMap<String, byte[]>> buckets = new ConcurrentHashMap<>();

    @Override
    public void put(String bucket, String key, byte[] data) {
        buckets.computeIfAbsent(bucket, b -> new ConcurrentSkipListMap<>()).put(key, data.clone());
    }

    @Override
    public Optional<byte[]> get(String bucket, String key) {
        Map<String, byte[]> b = buckets.get(bucket);
        byte[] v = b == null ? null : b.get(key);
        return v == null ? Optional.empty() : Optional.of(v.clone());
    }

    @Override
    public boolean exists(String bucket, String key) {
        Map<String, byte[]> b = buckets.get(bucket);
        return b != null && b.containsKey(key);
    }

    @Override
    public void delete(String bucket, String key) {
        Map<String, byte[]> b = buckets.get(bucket);
        if (b != null) b.remove(key);
    }

    @Override
    public List<String> list(String bucket) {
        ConcurrentSkipListMap<String, byte[]> b = buckets.get(bucket);
        return b == null ? List.of() : List.copyOf(b.keySet());
    }
}
