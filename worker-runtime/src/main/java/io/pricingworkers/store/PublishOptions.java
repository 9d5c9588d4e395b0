package io.pricingworkers.store;

import java.time.Duration;

/**
 * Per-publish overrides of the store-wide gates.
 *
 * @param cacheKey cache entry name to write instead of {@code bucket:key}, or null
 * @param ttl      cache TTL, or null for the store default
 */
public record PublishOptions(boolean upload, boolean cache, Duration ttl, String cacheKey) {

    public PublishOptions withTtl(Duration ttl) { return new PublishOptions(upload, cache, ttl, cacheKey); }

    public PublishOptions withCacheKey(String cacheKey) { return new PublishOptions(upload, cache, ttl, cacheKey); }

    public PublishOptions withUpload(boolean upload) { return new PublishOptions(upload, cache, ttl, cacheKey); }

    public PublishOptions withCache(boolean cache) { return new PublishOptions(upload, cache, ttl, cacheKey); }
}
