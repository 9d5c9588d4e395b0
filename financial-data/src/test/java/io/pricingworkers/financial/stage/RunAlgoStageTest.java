package io.pricingworkers.financial.stage;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.financial.Fixtures;
import io.pricingworkers.financial.algo.Algorithm;
import io.pricingworkers.financial.algo.AlgorithmInput;
import io.pricingworkers.financial.algo.AlgorithmRegistry;
import io.pricingworkers.financial.algo.AlgorithmReport;
import io.pricingworkers.financial.algo.BuyAndHold;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunAlgoStageTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
    private final DatasetStore store = Fixtures.store(clock);

    private StageResult run(AlgorithmRegistry registry, Map<String, Object> payload) {
        RunAlgoStage stage = new RunAlgoStage(store, registry, Duration.ofSeconds(10));
        return stage.execute(new StageContext(TaskEnvelope.create(TaskName.TASK_RUN_ALGO, payload, clock.instant()), clock));
    }

    @Test
    void publishes_report_for_the_prepared_dataset() {
        store.publish(DatasetKey.pricingLatest("SPY"), Fixtures.dataset("SPY", 30, 100));

        StageResult r = run(AlgorithmRegistry.defaults(), Map.of("ticker", "SPY", "algo", "buy_and_hold", "balance", "5000"));

        assertTrue(r.isSuccess(), r.toString());
        assertEquals(new DatasetKey("algoreport", "SPY_buy_and_hold_latest"), r.resultRef().datasetKey());
        AlgorithmReport report = store.fetchFresh(r.resultRef().datasetKey(), AlgorithmReport.class);
        assertEquals("buy_and_hold", report.name());
        assertEquals(30, report.numProcessed());
        assertEquals(5000.0, report.startingBalance());
        assertEquals(AlgorithmInput.DEFAULT_COMMISSION, report.commission());
    }

    @Test
    void reads_the_durable_copy_not_a_stale_cache_entry() {
        DatasetKey key = DatasetKey.pricingLatest("SPY");
        store.publish(key, Fixtures.dataset("SPY", 5, 100));
        // newer dataset lands durably while the cache still holds the old one
        store.publish(key, Fixtures.dataset("SPY", 12, 100), store.defaults().withCache(false));

        StageResult r = run(AlgorithmRegistry.defaults(), Map.of("ticker", "SPY", "algo", "buy_and_hold"));

        assertEquals(12, store.fetchFresh(r.resultRef().datasetKey(), AlgorithmReport.class).numProcessed());
    }

    @Test
    void missing_dataset_asks_for_a_soft_wait() {
        StageResult r = run(AlgorithmRegistry.defaults(), Map.of("ticker", "SPY", "algo", "buy_and_hold"));

        assertEquals(ErrorKind.DATA_UNAVAILABLE, r.error().kind());
        assertEquals("DatasetNotReady", r.error().code());
        assertEquals(Duration.ofSeconds(10), r.error().softWait());
    }

    @Test
    void unknown_algorithm_is_a_validation_failure() {
        store.publish(DatasetKey.pricingLatest("SPY"), Fixtures.dataset("SPY", 5, 100));
        StageResult r = run(AlgorithmRegistry.defaults(), Map.of("ticker", "SPY", "algo", "martingale"));
        assertEquals(ErrorKind.VALIDATION, r.error().kind());
    }

    @Test
    void algorithm_failure_is_reported_as_algorithm_error() {
        store.publish(DatasetKey.pricingLatest("SPY"), Fixtures.dataset("SPY", 5, 100));
        Algorithm broken = new Algorithm() {
            @Override public String id() { return "broken"; }
            @Override public AlgorithmReport run(AlgorithmInput input) { throw new ArithmeticException("divide by zero"); }
        };

        StageResult r = run(new AlgorithmRegistry(List.of(broken, new BuyAndHold())), Map.of("ticker", "SPY", "algo", "broken"));

        assertEquals(ErrorKind.ALGORITHM, r.error().kind());
        assertEquals("AlgorithmFailed", r.error().code());
        assertTrue(r.error().details().get("cause").contains("divide by zero"));
        assertFalse(store.exists(new DatasetKey("algoreport", "SPY_broken_latest")));
    }
}
