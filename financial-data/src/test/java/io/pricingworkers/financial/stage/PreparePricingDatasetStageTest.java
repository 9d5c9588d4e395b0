package io.pricingworkers.financial.stage;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.financial.Fixtures;
import io.pricingworkers.financial.pricing.PricingDataset;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.InMemoryObjectStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PreparePricingDatasetStageTest {
    private final InMemoryObjectStore objects = new InMemoryObjectStore();
    private final DatasetStore store = Fixtures.store(objects, Clock.systemUTC());
    private final PreparePricingDatasetStage stage = new PreparePricingDatasetStage(store, 30, 1);

    private StageResult run(Map<String, Object> payload, Instant now) {
        TaskEnvelope env = TaskEnvelope.create(TaskName.PREPARE_PRICING_DATASET, payload, now);
        return stage.execute(new StageContext(env, Clock.fixed(now, ZoneOffset.UTC)));
    }

    @Test
    void publishes_prepared_dataset_to_both_tiers() {
        StageResult r = run(Map.of("ticker", "spy", "data", Fixtures.csv(40), "source", "yahoo"), Instant.now());

        assertTrue(r.isSuccess(), r.toString());
        assertEquals(DatasetKey.pricingLatest("SPY"), r.resultRef().datasetKey());
        PricingDataset ds = store.fetchFresh(DatasetKey.pricingLatest("SPY"), PricingDataset.class);
        assertEquals("SPY", ds.ticker());
        assertEquals(40, ds.size());
        assertEquals(ds.last().date(), ds.asOf());
        assertEquals("yahoo", ds.source());
        assertTrue(store.fetchEntry(DatasetKey.pricingLatest("SPY"), PricingDataset.class).fromCache());
    }

    @Test
    void rerunning_the_same_payload_produces_byte_identical_output() {
        Map<String, Object> payload = Map.of("ticker", "SPY", "data", Fixtures.csv(35));
        StageResult first = run(payload, Instant.parse("2024-03-01T00:00:00Z"));
        byte[] firstBytes = objects.get("pricing", "SPY_latest").orElseThrow();

        StageResult second = run(payload, Instant.parse("2024-03-05T12:00:00Z"));
        byte[] secondBytes = objects.get("pricing", "SPY_latest").orElseThrow();

        assertArrayEquals(firstBytes, secondBytes);
        assertEquals(first.resultRef(), second.resultRef());
    }

    @Test
    void too_few_rows_is_permanent_insufficient_data() {
        StageResult r = run(Map.of("ticker", "SPY", "data", Fixtures.csv(10)), Instant.now());

        assertFalse(r.isSuccess());
        assertEquals(ErrorKind.DATA_UNAVAILABLE, r.error().kind());
        assertEquals("InsufficientData", r.error().code());
        assertNull(r.error().softWait());
        assertEquals("10", r.error().details().get("rows"));
        assertFalse(objects.exists("pricing", "SPY_latest"));
    }

    @Test
    void range_filter_applies_before_the_row_check() {
        LocalDate end = Fixtures.FIRST_DAY.plusDays(10);
        StageResult r = run(Map.of("ticker", "SPY", "data", Fixtures.csv(40), "end", end.toString()), Instant.now());
        assertEquals("InsufficientData", r.error().code());
    }

    @Test
    void malformed_csv_is_a_validation_failure() {
        StageResult r = run(Map.of("ticker", "SPY", "data", "foo,bar\n1,2\n"), Instant.now());
        assertEquals(ErrorKind.VALIDATION, r.error().kind());
    }

    @Test
    void run_algo_chains_one_task_per_algorithm() {
        StageResult r = run(Map.of("ticker", "SPY", "data", Fixtures.csv(30), "run_algo", "buy_and_hold, sma_cross"), Instant.now());

        assertEquals(2, r.followUps().size());
        TaskEnvelope f = r.followUps().get(1);
        assertEquals(TaskName.TASK_RUN_ALGO, f.taskName());
        assertEquals("sma_cross", f.payload().get("algo"));
        assertEquals("SPY", f.payload().get("ticker"));
        assertNotNull(f.parentTaskId());
    }
}
