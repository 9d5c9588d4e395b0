package io.pricingworkers.financial.stage;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.financial.Fixtures;
import io.pricingworkers.financial.algo.AlgorithmRegistry;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScreenerStageTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);
    private final DatasetStore store = Fixtures.store(clock);
    private final ScreenerStage stage = new ScreenerStage(store, AlgorithmRegistry.defaults());

    @BeforeEach
    void prepare() {
        store.publish(DatasetKey.pricingLatest("SPY"), Fixtures.dataset("SPY", 30, 400));
        store.publish(DatasetKey.pricingLatest("QQQ"), Fixtures.dataset("QQQ", 30, 100));
        store.publish(DatasetKey.pricingLatest("IWM"), Fixtures.dataset("IWM", 5, 100));
    }

    private StageResult run(Map<String, Object> payload) {
        return stage.execute(new StageContext(TaskEnvelope.create(TaskName.TASK_SCREENER_ANALYSIS, payload, clock.instant()), clock));
    }

    @Test
    void fans_out_one_run_algo_per_selected_ticker() {
        StageResult r = run(Map.of("universe", "spy,qqq,iwm,gone", "min_rows", 20, "algo", "sma_cross"));

        assertTrue(r.isSuccess());
        assertNull(r.resultRef());
        assertEquals(List.of("SPY", "QQQ"), r.followUps().stream().map(f -> f.payload().get("ticker")).toList());
        r.followUps().forEach(f -> {
            assertEquals(TaskName.TASK_RUN_ALGO, f.taskName());
            assertEquals("sma_cross", f.payload().get("algo"));
        });
        assertEquals(List.of("IWM"), r.summary().get("rejected"));
        assertEquals(List.of("GONE"), r.summary().get("missing"));
    }

    @Test
    void close_bounds_filter_on_the_last_close() {
        StageResult r = run(Map.of("universe", "SPY,QQQ", "max_close", 200.0));
        assertEquals(List.of("QQQ"), r.followUps().stream().map(f -> f.payload().get("ticker")).toList());
        assertEquals("buy_and_hold", r.followUps().get(0).payload().get("algo"));
    }

    @Test
    void unknown_algorithm_fails_before_fan_out() {
        StageResult r = run(Map.of("universe", "SPY", "algo", "nope"));
        assertEquals(ErrorKind.VALIDATION, r.error().kind());
        assertTrue(r.followUps().isEmpty());
    }
}
