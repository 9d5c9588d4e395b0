package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.StageException;
import io.pricingworkers.financial.pricing.PricingCsv;
import io.pricingworkers.financial.pricing.PricingDataset;
import io.pricingworkers.financial.pricing.PricingNormalizer;
import io.pricingworkers.financial.pricing.PricingRow;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Normalizes raw CSV into a {@link PricingDataset} and publishes it to both tiers as {@code pricing/{TICKER}_latest}.
 * Output depends only on the payload, so re-running a task republishes identical bytes.
 */
public class PreparePricingDatasetStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(PreparePricingDatasetStage.class);

    private final DatasetStore store;
    private final int minRows;
    private final long defaultTickerId;

    @Inject
    public PreparePricingDatasetStage(DatasetStore store, WorkerConfig config) {
        this(store, config.minPreparedRows(), config.tickerId());
    }

    public PreparePricingDatasetStage(DatasetStore store, int minRows, long defaultTickerId) {
        super(TaskName.PREPARE_PRICING_DATASET);
        this.store = store;
        this.minRows = minRows;
        this.defaultTickerId = defaultTickerId;
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String ticker = p.ticker();
        PricingCsv.Parsed parsed = PricingCsv.parse(p.string("data"));
        PricingNormalizer.Normalized n = PricingNormalizer.normalize(parsed.bars(),
                p.optDate("start").orElse(null), p.optDate("end").orElse(null));
        List<PricingRow> rows = n.rows();
        if (rows.size() < minRows) {
            throw StageException.dataUnavailable("InsufficientData",
                            ticker + " has " + rows.size() + " usable rows, need " + minRows)
                    .detail("rows", rows.size())
                    .detail("min_rows", minRows);
        }
        if (parsed.skipped() > 0 || n.dropped() > 0 || n.duplicates() > 0) {
            log.debug("ticker={} skipped={} dropped={} duplicates={}", ticker, parsed.skipped(), n.dropped(), n.duplicates());
        }

        PricingRow first = rows.get(0);
        PricingRow last = rows.get(rows.size() - 1);
        PricingDataset dataset = new PricingDataset(ticker,
                p.longValue("ticker_id", defaultTickerId),
                p.optString("source").orElse("csv"),
                last.date(), first.date(), last.date(),
                n.filled(), n.gaps(), rows);
        PublishReceipt receipt = store.publish(DatasetKey.pricingLatest(ticker), dataset);
        log.info("prepared ticker={} rows={} range={}..{} filled={} gaps={} cached={}", ticker, rows.size(),
                first.date(), last.date(), n.filled(), n.gaps().size(), receipt.cached());

        StageResult result = StageResult.success(receipt.ref())
                .withSummary("ticker", ticker)
                .withSummary("rows", rows.size())
                .withSummary("filled", n.filled())
                .withSummary("gaps", n.gaps().size())
                .withSummary("cached", receipt.cached());
        for (String algo : p.optString("run_algo").map(s -> s.split(",")).orElse(new String[0])) {
            if (algo.isBlank()) continue;
            result = result.withFollowUp(ctx.followUp(TaskName.TASK_RUN_ALGO, payload("ticker", ticker, "algo", algo.trim())));
        }
        return result;
    }
}
