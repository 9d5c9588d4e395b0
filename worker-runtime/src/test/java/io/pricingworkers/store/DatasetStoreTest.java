package io.pricingworkers.store;

import io.pricingworkers.MutableClock;
import io.pricingworkers.error.TransientInfraException;
import io.pricingworkers.metrics.Metrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DatasetStoreTest {
    private static final DatasetKey SPY = DatasetKey.pricingLatest("spy");

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-02T00:00:00Z"));
    private final InMemoryObjectStore objects = new InMemoryObjectStore();
    private final InMemoryKeyValueCache cache = new InMemoryKeyValueCache(0, clock);
    private final Metrics metrics = Metrics.standalone();

    private DatasetStore store(boolean upload, boolean publish) {
        return new DatasetStore(objects, cache, new DatasetCodec(), Duration.ofSeconds(300), upload, publish, metrics);
    }

    @Test
    void latest_key_layout() {
        assertEquals("SPY_latest", SPY.key());
        assertEquals("pricing:SPY_latest", SPY.cacheKey());
        assertThrows(IllegalArgumentException.class, () -> new DatasetKey("pricing", "../etc"));
    }

    @Test
    void publish_writes_both_tiers_with_the_same_bytes() throws Exception {
        DatasetStore store = store(true, true);
        PublishReceipt r = store.publish(SPY, Map.of("b", 2, "a", 1));
        assertTrue(r.durable());
        assertTrue(r.cached());
        byte[] durable = objects.get("pricing", "SPY_latest").orElseThrow();
        assertArrayEquals(durable, cache.get("pricing:SPY_latest").orElseThrow());
        assertEquals("{\"a\":1,\"b\":2}", new String(durable));
        assertEquals(DatasetCodec.version(durable), r.ref().version());
    }

    @Test
    void identical_content_gives_identical_version() {
        DatasetStore store = store(true, true);
        String v1 = store.publish(SPY, Map.of("x", List.of(1, 2, 3))).ref().version();
        String v2 = store.publish(SPY, Map.of("x", List.of(1, 2, 3))).ref().version();
        String v3 = store.publish(SPY, Map.of("x", List.of(1, 2))).ref().version();
        assertEquals(v1, v2);
        assertNotEquals(v1, v3);
    }

    @Test
    void cache_failure_degrades_but_does_not_fail_publish() {
        KeyValueCache broken = new FailingCache();
        DatasetStore store = new DatasetStore(objects, broken, new DatasetCodec(), Duration.ofSeconds(300), true, true, metrics);
        PublishReceipt r = store.publish(SPY, Map.of("a", 1));
        assertTrue(r.durable());
        assertFalse(r.cached());
        assertEquals(1, metrics.counter(Metrics.CACHE_DEGRADED).getCount());
        assertEquals(Map.of("a", 1), store.fetch(SPY, Map.class));
    }

    @Test
    void durable_failure_is_transient_infra() {
        DatasetStore store = new DatasetStore(new FailingObjectStore(), cache, null, Duration.ofSeconds(1), true, true, metrics);
        assertThrows(TransientInfraException.class, () -> store.publish(SPY, Map.of()));
        assertThrows(TransientInfraException.class, () -> store.fetchFresh(SPY, Map.class));
        assertTrue(cache.get(SPY.cacheKey()).isEmpty());
    }

    @Test
    void fetch_reads_through_and_repopulates_cache() throws Exception {
        DatasetStore store = store(true, true);
        store.publish(SPY, Map.of("a", 1));
        store.invalidate(SPY);
        assertTrue(cache.get(SPY.cacheKey()).isEmpty());
        assertTrue(objects.exists("pricing", "SPY_latest"));

        DatasetStore.Fetched<Map> f = store.fetchEntry(SPY, Map.class);
        assertFalse(f.fromCache());
        assertTrue(cache.get(SPY.cacheKey()).isPresent());
        assertTrue(store.fetchEntry(SPY, Map.class).fromCache());
    }

    @Test
    void fetch_fresh_bypasses_a_stale_cache() throws Exception {
        DatasetStore store = store(true, true);
        store.publish(SPY, Map.of("v", 1));
        cache.set(SPY.cacheKey(), "{\"v\":0}".getBytes(), Duration.ofMinutes(1));
        assertEquals(0, store.fetch(SPY, Map.class).get("v"));
        assertEquals(1, store.fetchFresh(SPY, Map.class).get("v"));
    }

    @Test
    void missing_everywhere_is_not_found() {
        DatasetStore store = store(true, true);
        assertThrows(DatasetNotFoundException.class, () -> store.fetch(SPY, Map.class));
        assertThrows(DatasetNotFoundException.class, () -> store.fetchFresh(SPY, Map.class));
        assertThrows(DatasetNotFoundException.class, () -> store.promoteToCache(SPY, null));
    }

    @Test
    void cache_entries_expire_after_ttl() throws Exception {
        DatasetStore store = store(true, true);
        store.publish(SPY, Map.of("a", 1));
        clock.advance(Duration.ofSeconds(301));
        assertTrue(cache.get(SPY.cacheKey()).isEmpty());
        assertEquals(Map.of("a", 1), store.fetch(SPY, Map.class));
    }

    @Test
    void disabled_gates_skip_their_tier_and_still_succeed() throws Exception {
        PublishReceipt noUpload = store(false, true).publish(SPY, Map.of("a", 1));
        assertFalse(noUpload.durable());
        assertTrue(noUpload.cached());
        assertFalse(objects.exists("pricing", "SPY_latest"));

        cache.delete(SPY.cacheKey());
        PublishReceipt noPublish = store(true, false).publish(SPY, Map.of("a", 1));
        assertTrue(noPublish.durable());
        assertFalse(noPublish.cached());
        assertTrue(cache.get(SPY.cacheKey()).isEmpty());
    }

    @Test
    void promote_and_archive_move_bytes_between_tiers() throws Exception {
        DatasetStore store = store(true, true);
        objects.put("pricing", "SPY_latest", "{\"a\":1}".getBytes());
        store.promoteToCache(SPY, "SPY", Duration.ofSeconds(10));
        assertEquals("{\"a\":1}", new String(cache.get("SPY").orElseThrow()));

        cache.set("scratch", "{\"b\":2}".getBytes(), null);
        DatasetKey target = new DatasetKey("pricing", "SPY_raw");
        DatasetRef ref = store.archiveFromCache("scratch", target);
        assertEquals(DatasetCodec.version("{\"b\":2}".getBytes()), ref.version());
        assertEquals("{\"b\":2}", new String(objects.get("pricing", "SPY_raw").orElseThrow()));
    }

    @Test
    void file_object_store_round_trip(@TempDir Path dir) throws Exception {
        FileObjectStore files = new FileObjectStore(dir);
        files.put("pricing", "SPY_latest", "abc".getBytes());
        files.put("pricing", "QQQ_latest", "def".getBytes());
        assertEquals("abc", new String(files.get("pricing", "SPY_latest").orElseThrow()));
        assertEquals(List.of("QQQ_latest", "SPY_latest"), files.list("pricing"));
        assertTrue(Files.exists(dir.resolve("pricing").resolve("SPY_latest")));
        assertEquals(Optional.empty(), files.get("pricing", "nope"));
        files.delete("pricing", "SPY_latest");
        assertFalse(files.exists("pricing", "SPY_latest"));
    }

    private static final class FailingCache implements KeyValueCache {
        @Override public Optional<byte[]> get(String key) throws IOException { throw new IOException("cache down"); }
        @Override public void set(String key, byte[] value, Duration ttl) throws IOException { throw new IOException("cache down"); }
        @Override public void delete(String key) throws IOException { throw new IOException("cache down"); }
        @Override public int namespace() { return 0; }
    }

    private static final class FailingObjectStore implements ObjectStore {
        @Override public void put(String bucket, String key, byte[] data) throws IOException { throw new IOException("disk gone"); }
        @Override public Optional<byte[]> get(String bucket, String key) throws IOException { throw new IOException("disk gone"); }
        @Override public boolean exists(String bucket, String key) throws IOException { throw new IOException("disk gone"); }
        @Override public void delete(String bucket, String key) throws IOException { throw new IOException("disk gone"); }
        @Override public List<String> list(String bucket) throws IOException { throw new IOException("disk gone"); }
    }
}
