package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.config.WorkerConfig;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.error.StageException;
import io.pricingworkers.financial.algo.Algorithm;
import io.pricingworkers.financial.algo.AlgorithmInput;
import io.pricingworkers.financial.algo.AlgorithmRegistry;
import io.pricingworkers.financial.algo.AlgorithmReport;
import io.pricingworkers.financial.pricing.PricingDataset;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetNotFoundException;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs an algorithm over the durable copy of a prepared dataset and publishes the report as
 * {@code algoreport/{TICKER}_{algo}_latest}. A dataset that is not there yet asks for one soft-wait requeue.
 */
public class RunAlgoStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(RunAlgoStage.class);

    private final DatasetStore store;
    private final AlgorithmRegistry algorithms;
    private final Duration softWait;

    @Inject
    public RunAlgoStage(DatasetStore store, AlgorithmRegistry algorithms, WorkerConfig config) {
        this(store, algorithms, config.algoSoftWait());
    }

    public RunAlgoStage(DatasetStore store, AlgorithmRegistry algorithms, Duration softWait) {
        super(TaskName.TASK_RUN_ALGO);
        this.store = store;
        this.algorithms = algorithms;
        this.softWait = softWait;
    }

    static DatasetKey reportKey(String ticker, String algo) {
        return new DatasetKey(DatasetKey.ALGO_REPORT_BUCKET, ticker + "_" + algo + DatasetKey.LATEST_SUFFIX);
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        String ticker = p.ticker();
        String algoId = p.string("algo").trim();
        Algorithm algorithm = algorithms.find(algoId)
                .orElseThrow(() -> StageException.validation("unknown algorithm '" + algoId + "', known: " + algorithms.ids()));

        DatasetKey source = DatasetKey.pricingLatest(ticker);
        DatasetStore.Fetched<PricingDataset> dataset;
        try {
            // the cache may still hold an older dataset, so read the durable copy
            dataset = store.fetchFreshEntry(source, PricingDataset.class);
        } catch (DatasetNotFoundException e) {
            throw StageException.dataUnavailable("DatasetNotReady", source + " has not been prepared yet")
                    .detail("dataset", source)
                    .softWait(softWait);
        }

        AlgorithmInput input = new AlgorithmInput(ticker, dataset.value().rows(),
                p.decimal("balance", AlgorithmInput.DEFAULT_BALANCE),
                p.decimal("commission", AlgorithmInput.DEFAULT_COMMISSION));
        AlgorithmReport report;
        try {
            report = algorithm.run(input);
        } catch (RuntimeException e) {
            throw new StageException(ErrorKind.ALGORITHM, "AlgorithmFailed", algoId + " failed on " + ticker, e)
                    .detail("dataset_version", dataset.ref().version());
        }

        PublishReceipt receipt = store.publish(reportKey(ticker, algoId), report);
        log.info("algo={} ticker={} rows={} balance={} buys={} sells={}", algoId, ticker, report.numProcessed(),
                report.balance(), report.buys().size(), report.sells().size());
        return StageResult.success(receipt.ref())
                .withSummary("ticker", ticker)
                .withSummary("algo", algoId)
                .withSummary("dataset_version", dataset.ref().version())
                .withSummary("balance", report.balance())
                .withSummary("open_shares", report.openShares());
    }
}
