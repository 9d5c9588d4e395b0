package io.pricingworkers.store;

import com.codahale.metrics.Counter;
import io.pricingworkers.error.TransientInfraException;
import io.pricingworkers.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Dual-tier dataset store. The object store is authoritative; the cache mirrors it with a TTL and may be
 * missing, stale or unavailable without failing a publish.
 */
public class DatasetStore {
    private static final Logger log = LoggerFactory.getLogger(DatasetStore.class);

    private final ObjectStore objects;
    private final KeyValueCache cache;
    private final DatasetCodec codec;
    private final Duration defaultTtl;
    private final boolean enabledUpload;
    private final boolean enabledPublish;
    private final Counter degraded;

    public DatasetStore(ObjectStore objects,
                        KeyValueCache cache,
                        DatasetCodec codec,
                        Duration defaultTtl,
                        boolean enabledUpload,
                        boolean enabledPublish,
                        Metrics metrics) {
        this.objects = Objects.requireNonNull(objects);
        this.cache = Objects.requireNonNull(cache);
        this.codec = codec == null ? new DatasetCodec() : codec;
        this.defaultTtl = defaultTtl;
        this.enabledUpload = enabledUpload;
        this.enabledPublish = enabledPublish;
        this.degraded = (metrics == null ? Metrics.standalone() : metrics).counter(Metrics.CACHE_DEGRADED);
    }

    public PublishOptions defaults() {
        return new PublishOptions(enabledUpload, enabledPublish, defaultTtl, null);
    }

    public PublishReceipt publish(DatasetKey key, Object value) {
        return publish(key, value, defaults());
    }

    /**
     * Writes the durable tier first, then the cache. A durable failure throws {@link TransientInfraException};
     * a cache failure only downgrades the receipt.
     */
    public PublishReceipt publish(DatasetKey key, Object value, PublishOptions options) {
        byte[] bytes;
        try {
            bytes = codec.encode(value);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot encode dataset " + key, e);
        }
        DatasetRef ref = DatasetRef.of(key, DatasetCodec.version(bytes));
        boolean durable = false;
        if (options.upload()) {
            writeDurable(key, bytes);
            durable = true;
        } else {
            log.debug("upload disabled, skipping durable write of {}", key);
        }
        boolean cached = false;
        if (options.cache()) {
            String ck = options.cacheKey() == null ? key.cacheKey() : options.cacheKey();
            cached = writeCache(ck, bytes, options.ttl() == null ? defaultTtl : options.ttl());
        } else {
            log.debug("publish disabled, skipping cache write of {}", key);
        }
        log.info("published {} version={} durable={} cached={}", key, ref.version().substring(0, 12), durable, cached);
        return new PublishReceipt(ref, durable, cached);
    }

    public <T> T fetch(DatasetKey key, Class<T> type) {
        return fetchEntry(key, type).value();
    }

    /** Read-through: cache first, then the object store, repopulating the cache on a durable hit. */
    public <T> Fetched<T> fetchEntry(DatasetKey key, Class<T> type) {
        Optional<byte[]> hit = readCache(key.cacheKey());
        if (hit.isPresent()) {
            return new Fetched<>(decode(key, hit.get(), type), DatasetRef.of(key, DatasetCodec.version(hit.get())), true);
        }
        byte[] bytes = readDurable(key).orElseThrow(() -> new DatasetNotFoundException(key));
        if (enabledPublish) writeCache(key.cacheKey(), bytes, defaultTtl);
        return new Fetched<>(decode(key, bytes, type), DatasetRef.of(key, DatasetCodec.version(bytes)), false);
    }

    /** Durable tier only; the cache is neither read nor written. */
    public <T> T fetchFresh(DatasetKey key, Class<T> type) {
        return fetchFreshEntry(key, type).value();
    }

    public <T> Fetched<T> fetchFreshEntry(DatasetKey key, Class<T> type) {
        byte[] bytes = readDurable(key).orElseThrow(() -> new DatasetNotFoundException(key));
        return new Fetched<>(decode(key, bytes, type), DatasetRef.of(key, DatasetCodec.version(bytes)), false);
    }

    public boolean exists(DatasetKey key) {
        try {
            return objects.exists(key.bucket(), key.key());
        } catch (IOException e) {
            throw new TransientInfraException("object store unavailable checking " + key, e);
        }
    }

    /** Removes the cache entry only. Durable data is never deleted here. */
    public void invalidate(DatasetKey key) {
        try {
            cache.delete(key.cacheKey());
        } catch (IOException | RuntimeException e) {
            markDegraded("invalidate " + key, e);
        }
    }

    public DatasetRef promoteToCache(DatasetKey key, Duration ttl) {
        return promoteToCache(key, null, ttl);
    }

    /**
     * Copies the durable object into the cache under {@code cacheKey} (or {@code bucket:key}).
     * Unlike publish, a cache failure here fails the operation since the cache write is its only effect.
     */
    public DatasetRef promoteToCache(DatasetKey key, String cacheKey, Duration ttl) {
        byte[] bytes = readDurable(key).orElseThrow(() -> new DatasetNotFoundException(key));
        String ck = cacheKey == null ? key.cacheKey() : cacheKey;
        try {
            cache.set(ck, bytes, ttl == null ? defaultTtl : ttl);
        } catch (IOException e) {
            throw new TransientInfraException("cache unavailable promoting " + key, e);
        }
        return DatasetRef.of(key, DatasetCodec.version(bytes));
    }

    public DatasetRef archiveFromCache(DatasetKey key) {
        return archiveFromCache(key.cacheKey(), key);
    }

    /** Copies the cached value at {@code cacheKey} into the durable tier at {@code target}. */
    public DatasetRef archiveFromCache(String cacheKey, DatasetKey target) {
        Optional<byte[]> bytes;
        try {
            bytes = cache.get(cacheKey);
        } catch (IOException e) {
            throw new TransientInfraException("cache unavailable archiving " + cacheKey, e);
        }
        byte[] data = bytes.orElseThrow(() -> new DatasetNotFoundException(target));
        writeDurable(target, data);
        return DatasetRef.of(target, DatasetCodec.version(data));
    }

    public ObjectStore objectStore() { return objects; }

    public KeyValueCache cache() { return cache; }

    private void writeDurable(DatasetKey key, byte[] bytes) {
        try {
            objects.put(key.bucket(), key.key(), bytes);
        } catch (IOException e) {
            throw new TransientInfraException("object store write failed for " + key, e);
        }
    }

    private Optional<byte[]> readDurable(DatasetKey key) {
        try {
            return objects.get(key.bucket(), key.key());
        } catch (IOException e) {
            throw new TransientInfraException("object store read failed for " + key, e);
        }
    }

    private boolean writeCache(String cacheKey, byte[] bytes, Duration ttl) {
        try {
            cache.set(cacheKey, bytes, ttl);
            return true;
        } catch (IOException | RuntimeException e) {
            markDegraded("write " + cacheKey, e);
            return false;
        }
    }

    private Optional<byte[]> readCache(String cacheKey) {
        try {
            return cache.get(cacheKey);
        } catch (IOException | RuntimeException e) {
            markDegraded("read " + cacheKey, e);
            return Optional.empty();
        }
    }

    private void markDegraded(String op, Exception e) {
        degraded.inc();
        log.warn("degraded cache: {} failed: {}", op, e.toString());
    }

    private <T> T decode(DatasetKey key, byte[] bytes, Class<T> type) {
        try {
            return codec.decode(bytes, type);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot decode dataset " + key + " as " + type.getSimpleName(), e);
        }
    }

    public record Fetched<T>(T value, DatasetRef ref, boolean fromCache) {}
}
