package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.StageException;
import io.pricingworkers.financial.algo.AlgorithmRegistry;
import io.pricingworkers.financial.algo.BuyAndHold;
import io.pricingworkers.financial.pricing.PricingDataset;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetNotFoundException;
import io.pricingworkers.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Screens a ticker universe against the prepared datasets and fans out one {@code task_run_algo} per ticker
 * that passes. Tickers without a prepared dataset are skipped.
 */
public class ScreenerStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(ScreenerStage.class);

    private final DatasetStore store;
    private final AlgorithmRegistry algorithms;

    @Inject
    public ScreenerStage(DatasetStore store, AlgorithmRegistry algorithms) {
        super(TaskName.TASK_SCREENER_ANALYSIS);
        this.store = store;
        this.algorithms = algorithms;
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String algo = p.optString("algo").orElse(BuyAndHold.ID).trim();
        if (algorithms.find(algo).isEmpty()) {
            throw StageException.validation("unknown algorithm '" + algo + "', known: " + algorithms.ids());
        }
        long minRows = p.longValue("min_rows", 1);
        Optional<Double> minClose = p.optDecimal("min_close");
        Optional<Double> maxClose = p.optDecimal("max_close");

        List<String> selected = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (String ticker : p.tickers("universe")) {
            PricingDataset ds;
            try {
                ds = store.fetch(DatasetKey.pricingLatest(ticker), PricingDataset.class);
            } catch (DatasetNotFoundException e) {
                missing.add(ticker);
                continue;
            }
            if (ds.size() == 0 || ds.size() < minRows) {
                rejected.add(ticker);
                continue;
            }
            double close = ds.last().close();
            if (minClose.isPresent() && close < minClose.get() || maxClose.isPresent() && close > maxClose.get()) {
                rejected.add(ticker);
                continue;
            }
            selected.add(ticker);
        }
        log.info("screener algo={} selected={} rejected={} missing={}", algo, selected, rejected, missing);

        StageResult result = StageResult.success()
                .withSummary("algo", algo)
                .withSummary("selected", selected)
                .withSummary("rejected", rejected)
                .withSummary("missing", missing);
        for (String ticker : selected) {
            result = result.withFollowUp(ctx.followUp(TaskName.TASK_RUN_ALGO, payload("ticker", ticker, "algo", algo)));
        }
        return result;
    }
}
