package io.pricingworkers.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier. Authoritative source of every published dataset.
 */
public interface ObjectStore {
    void put(String bucket, String key, byte[] data) throws IOException;

    Optional<byte[]> get(String bucket, String key) throws IOException;

    boolean exists(String bucket, String key) throws IOException;

    void delete(String bucket, String key) throws IOException;

    List<String> list(String bucket) throws IOException;
}
