package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.StageException;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetRef;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.PublishOptions;
import io.pricingworkers.store.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Publishes a ticker's raw pricing blob to the object store and the cache. The per-task {@code s3_enabled} and
 * {@code redis_enabled} flags override the global gates; with {@code from_cache} the cached value is archived
 * into the object store instead. The summary reports {@code SUCCESS}, or {@code NOT_RUN} when both tiers are off.
 */
public class PublishPricingUpdateStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(PublishPricingUpdateStage.class);
    static final String SUCCESS = "SUCCESS";
    static final String NOT_RUN = "NOT_RUN";

    private final DatasetStore store;
    private final long defaultTickerId;

    @Inject
    public PublishPricingUpdateStage(DatasetStore store, WorkerConfig config) {
        this(store, config.tickerId());
    }

    public PublishPricingUpdateStage(DatasetStore store, long defaultTickerId) {
        super(TaskName.PUBLISH_PRICING_UPDATE);
        this.store = store;
        this.defaultTickerId = defaultTickerId;
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String ticker = p.ticker();
        PublishOptions defaults = store.defaults();
        boolean s3Enabled = p.optBoolean("s3_enabled").orElse(defaults.upload());
        boolean redisEnabled = p.optBoolean("redis_enabled").orElse(defaults.cache());
        DatasetKey key = new DatasetKey(
                p.optString("s3_bucket").orElse(DatasetKey.PRICING_BUCKET),
                p.optString("s3_key").orElse(ticker + HandlePricingUpdateStage.RAW_SUFFIX));
        String redisKey = p.optString("redis_key").orElse(key.cacheKey());

        StageResult result;
        String status;
        if (p.optBoolean("from_cache").orElse(false)) {
            DatasetRef ref = store.archiveFromCache(redisKey, key);
            log.info("archived cache key={} into {}", redisKey, key);
            result = StageResult.success(ref);
            status = SUCCESS;
        } else if (!s3Enabled && !redisEnabled) {
            log.info("publish skipped ticker={} s3 and redis disabled", ticker);
            result = StageResult.success();
            status = NOT_RUN;
        } else {
            if (!p.has("data")) throw StageException.validation("missing field 'data' for " + ticker);
            PublishOptions options = defaults.withUpload(s3Enabled).withCache(redisEnabled).withCacheKey(redisKey);
            if (p.has("redis_expire")) options = options.withTtl(Duration.ofSeconds(p.longValue("redis_expire", 0)));
            PublishReceipt receipt = store.publish(key, p.string("data").getBytes(StandardCharsets.UTF_8), options);
            result = StageResult.success(receipt.ref()).withSummary("cached", receipt.cached());
            status = SUCCESS;
        }
        return result
                .withSummary("status", status)
                .withSummary("ticker", ticker)
                .withSummary("ticker_id", p.longValue("ticker_id", defaultTickerId))
                .withSummary("s3_enabled", s3Enabled)
                .withSummary("redis_enabled", redisEnabled)
                .withSummary("s3_bucket", key.bucket())
                .withSummary("s3_key", key.key())
                .withSummary("redis_key", redisKey)
                .withSummary("updated", p.optString("updated").orElse(null));
    }
}
