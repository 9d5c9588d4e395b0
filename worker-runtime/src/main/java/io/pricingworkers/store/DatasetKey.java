package io.pricingworkers.store;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Addresses a dataset in both tiers: object-store bucket/key and the mirrored cache key.
 */
public record DatasetKey(String bucket, String key) {
    public static final String PRICING_BUCKET = "pricing";
    public static final String COMPILED_BUCKET = "compileddatasets";
    public static final String ALGO_REPORT_BUCKET = "algoreport";
    public static final String LATEST_SUFFIX = "_latest";

    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9._=^:\\-]+");

    public DatasetKey {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(key, "key");
        if (!SAFE.matcher(bucket).matches() || bucket.contains(":")) throw new IllegalArgumentException("invalid bucket: " + bucket);
        if (!SAFE.matcher(key).matches() || key.startsWith(".")) throw new IllegalArgumentException("invalid key: " + key);
    }

    /** {@code {TICKER}_latest} in the given bucket. */
    public static DatasetKey latest(String bucket, String ticker) {
        return new DatasetKey(bucket, ticker.trim().toUpperCase(Locale.ROOT) + LATEST_SUFFIX);
    }

    public static DatasetKey pricingLatest(String ticker) { return latest(PRICING_BUCKET, ticker); }

    public String cacheKey() { return bucket + ":" + key; }

    @Override
    public String toString() { return bucket + "/" + key; }
}
