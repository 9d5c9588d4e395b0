package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.StageException;
import io.pricingworkers.financial.pricing.PriceBar;
import io.pricingworkers.financial.pricing.PricingCsv;
import io.pricingworkers.financial.pricing.PricingNormalizer;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetNotFoundException;
import io.pricingworkers.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Propagates a pricing update: merges the incoming rows into the ticker's raw archive, then chains the raw
 * publish and the dataset preparation with the merged CSV.
 */
public class HandlePricingUpdateStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(HandlePricingUpdateStage.class);
    static final String RAW_SUFFIX = "_raw";

    private final DatasetStore store;
    private final long defaultTickerId;

    @Inject
    public HandlePricingUpdateStage(DatasetStore store, WorkerConfig config) {
        this(store, config.tickerId());
    }

    public HandlePricingUpdateStage(DatasetStore store, long defaultTickerId) {
        super(TaskName.HANDLE_PRICING_UPDATE_TASK);
        this.store = store;
        this.defaultTickerId = defaultTickerId;
    }

    static DatasetKey rawKey(String ticker) {
        return new DatasetKey(DatasetKey.PRICING_BUCKET, ticker.toUpperCase(Locale.ROOT) + RAW_SUFFIX);
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String ticker = p.ticker();
        List<PriceBar> incoming = PricingCsv.parse(p.string("data")).bars();
        List<PriceBar> existing = readArchive(ticker);
        List<PriceBar> merged = PricingNormalizer.merge(existing, incoming);
        String csv = PricingCsv.formatBars(merged);
        log.info("update ticker={} incoming={} archived={} merged={}", ticker, incoming.size(), existing.size(), merged.size());

        long tickerId = p.longValue("ticker_id", defaultTickerId);
        DatasetKey raw = rawKey(ticker);
        return StageResult.success()
                .withFollowUp(ctx.followUp(TaskName.PUBLISH_PRICING_UPDATE, payload(
                        "ticker", ticker,
                        "ticker_id", tickerId,
                        "data", csv,
                        "s3_bucket", raw.bucket(),
                        "s3_key", raw.key(),
                        "redis_key", raw.cacheKey(),
                        "updated", ctx.now().toString())))
                .withFollowUp(ctx.followUp(TaskName.PREPARE_PRICING_DATASET, payload(
                        "ticker", ticker,
                        "ticker_id", tickerId,
                        "data", csv,
                        "source", p.optString("source").orElse(null),
                        "run_algo", p.optString("run_algo").orElse(null))))
                .withSummary("ticker", ticker)
                .withSummary("incoming", incoming.size())
                .withSummary("merged", merged.size());
    }

    private List<PriceBar> readArchive(String ticker) {
        byte[] bytes;
        try {
            bytes = store.fetchFresh(rawKey(ticker), byte[].class);
        } catch (DatasetNotFoundException e) {
            return List.of();
        }
        try {
            return PricingCsv.parse(new String(bytes, StandardCharsets.UTF_8)).bars();
        } catch (StageException e) {
            log.warn("raw archive for {} is unreadable, it will be replaced: {}", ticker, e.getMessage());
            return List.of();
        }
    }
}
