package io.pricingworkers.financial.stage;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.financial.Fixtures;
import io.pricingworkers.financial.aggregate.AggregateCoordinator;
import io.pricingworkers.financial.aggregate.AggregateDataset;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class PublishTickerAggregateStageTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final DatasetStore store = Fixtures.store(clock);
    private final PublishTickerAggregateStage stage =
            new PublishTickerAggregateStage(store, new AggregateCoordinator(store, executor, Duration.ofSeconds(2), clock));

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private StageResult run(Map<String, Object> payload) {
        return stage.execute(new StageContext(TaskEnvelope.create(TaskName.PUBLISH_TICKER_AGGREGATE_FROM_S3, payload, clock.instant()), clock));
    }

    @Test
    void publishes_partial_aggregate_under_the_default_key() {
        store.publish(DatasetKey.pricingLatest("SPY"), Fixtures.dataset("SPY", 5, 100));

        StageResult r = run(Map.of("tickers", "SPY,QQQ"));

        assertTrue(r.isSuccess(), r.toString());
        assertEquals(new DatasetKey("compileddatasets", "aggregate_latest"), r.resultRef().datasetKey());
        assertEquals(true, r.summary().get("partial"));
        AggregateDataset agg = store.fetchFresh(r.resultRef().datasetKey(), AggregateDataset.class);
        assertEquals(Set.of("SPY"), agg.refs().keySet());
        assertEquals("missing", agg.skipped().get("QQQ"));
    }

    @Test
    void honours_custom_key() {
        store.publish(DatasetKey.pricingLatest("SPY"), Fixtures.dataset("SPY", 5, 100));
        StageResult r = run(Map.of("tickers", "SPY", "s3_key", "etf_daily"));
        assertEquals("etf_daily", r.resultRef().key());
    }

    @Test
    void nothing_available_is_data_unavailable() {
        StageResult r = run(Map.of("tickers", "QQQ,IWM"));
        assertEquals(ErrorKind.DATA_UNAVAILABLE, r.error().kind());
        assertEquals("NoDatasets", r.error().code());
    }
}
