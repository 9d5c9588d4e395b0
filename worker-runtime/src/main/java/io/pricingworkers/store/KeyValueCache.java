package io.pricingworkers.store;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Fast tier. Entries expire after their TTL; a null or zero TTL keeps the entry until deleted.
 */
public interface KeyValueCache {
    Optional<byte[]> get(String key) throws IOException;

    void set(String key, byte[] value, Duration ttl) throws IOException;

    void delete(String key) throws IOException;

    int namespace();
}
