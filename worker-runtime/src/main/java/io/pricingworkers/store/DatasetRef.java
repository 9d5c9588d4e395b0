package io.pricingworkers.store;

/**
 * Pointer to a published dataset. {@code version} is the SHA-256 of the stored bytes.
 */
public record DatasetRef(String bucket, String key, String version) {
    public DatasetKey datasetKey() { return new DatasetKey(bucket, key); }

    public static DatasetRef of(DatasetKey key, String version) {
        return new DatasetRef(key.bucket(), key.key(), version);
    }
}
