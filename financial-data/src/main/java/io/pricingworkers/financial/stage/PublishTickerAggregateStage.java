package io.pricingworkers.financial.stage;

import com.google.inject.Inject;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.core.TaskPayload;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.error.StageException;
import io.pricingworkers.financial.aggregate.AggregateCoordinator;
import io.pricingworkers.financial.aggregate.AggregateDataset;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;

public class PublishTickerAggregateStage extends PricingStage {
    private static final Logger log = LoggerFactory.getLogger(PublishTickerAggregateStage.class);
    static final String DEFAULT_KEY = "aggregate_latest";

    private final DatasetStore store;
    private final AggregateCoordinator coordinator;

    @Inject
    public PublishTickerAggregateStage(DatasetStore store, AggregateCoordinator coordinator) {
        super(TaskName.PUBLISH_TICKER_AGGREGATE_FROM_S3);
        this.store = store;
        this.coordinator = coordinator;
    }

    @Override
    protected StageResult run(StageContext ctx) {
        TaskPayload p = ctx.payload();
        DatasetKey target = new DatasetKey(DatasetKey.COMPILED_BUCKET, p.optString("s3_key").orElse(DEFAULT_KEY));
        AggregateDataset aggregate;
        try {
            aggregate = coordinator.compile(new LinkedHashSet<>(p.tickers("tickers")));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(ErrorKind.TRANSIENT_INFRA, "AggregateInterrupted", "interrupted compiling " + target, e);
        }
        if (aggregate.empty()) {
            throw StageException.dataUnavailable("NoDatasets", "none of " + aggregate.tickers() + " has a prepared dataset")
                    .detail("skipped", aggregate.skipped());
        }
        PublishReceipt receipt = store.publish(target, aggregate);
        log.info("aggregate {} included={} partial={}", target, aggregate.refs().keySet(), aggregate.partial());
        return StageResult.success(receipt.ref())
                .withSummary("included", aggregate.refs().keySet())
                .withSummary("skipped", aggregate.skipped())
                .withSummary("partial", aggregate.partial());
    }
}
