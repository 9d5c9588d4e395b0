package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetRef;
import io.pricingworkers.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Promotes a durable object into the cache, optionally under an alias key and a custom expiry.
 */
public class PublishFromS3ToRedisStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(PublishFromS3ToRedisStage.class);

    private final DatasetStore store;

    @Inject
    public PublishFromS3ToRedisStage(DatasetStore store) {
        super(TaskName.PUBLISH_FROM_S3_TO_REDIS);
        this.store = store;
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String ticker = p.ticker();
        DatasetKey source = new DatasetKey(
                p.optString("s3_bucket").orElse(DatasetKey.PRICING_BUCKET),
                p.optString("s3_key").orElse(ticker + DatasetKey.LATEST_SUFFIX));
        String cacheKey = p.optString("redis_key").orElse(source.cacheKey());
        Duration ttl = p.has("redis_expire") ? Duration.ofSeconds(p.longValue("redis_expire", 0)) : null;

        DatasetRef ref = store.promoteToCache(source, cacheKey, ttl);
        log.info("promoted {} to cache key={} ttl={}", source, cacheKey, ttl == null ? "default" : ttl);
        return StageResult.success(ref)
                .withSummary("ticker", ticker)
                .withSummary("s3_bucket", source.bucket())
                .withSummary("s3_key", source.key())
                .withSummary("redis_key", cacheKey);
    }
}
