package io.pricingworkers.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TaskEnvelopeTest {
    private static final Instant T0 = Instant.parse("2024-01-02T00:00:00Z");
    private static final String CSV = "date,open,high,low,close,volume\n2024-01-02,1,2,0.5,1.5,100\n";

    @Test
    void unknown_task_name_is_rejected() {
        assertThrows(InvalidPayloadException.class, () -> TaskName.fromWire("get_new_pricing"));
        assertEquals(TaskName.TASK_RUN_ALGO, TaskName.fromWire("task_run_algo"));
    }

    @Test
    void missing_required_field_is_rejected() {
        TaskEnvelope env = TaskEnvelope.create(TaskName.PREPARE_PRICING_DATASET, Map.of("ticker", "SPY"), T0);
        InvalidPayloadException e = assertThrows(InvalidPayloadException.class, env::validate);
        assertTrue(e.getMessage().contains("data"), e.getMessage());
    }

    @Test
    void wrongly_typed_fields_are_rejected() {
        assertThrows(InvalidPayloadException.class, () ->
                TaskEnvelope.create(TaskName.GET_NEW_PRICING_DATA, Map.of("ticker", "SPY", "start", "02/01/2024"), T0).validate());
        assertThrows(InvalidPayloadException.class, () ->
                TaskEnvelope.create(TaskName.TASK_RUN_ALGO, Map.of("ticker", "SPY", "algo", "x", "balance", "lots"), T0).validate());
        assertThrows(InvalidPayloadException.class, () ->
                TaskEnvelope.create(TaskName.GET_NEW_PRICING_DATA, Map.of("ticker", "not a ticker!"), T0).validate());
        assertThrows(InvalidPayloadException.class, () ->
                TaskEnvelope.create(TaskName.HANDLE_PRICING_UPDATE_TASK, Map.of("ticker", "SPY", "data", "no newline"), T0).validate());
    }

    @Test
    void valid_payloads_pass_and_numbers_may_arrive_as_strings() {
        TaskEnvelope.create(TaskName.TASK_RUN_ALGO, Map.of("ticker", "spy", "algo", "buy_and_hold", "balance", "10000.5"), T0).validate();
        TaskEnvelope.create(TaskName.PREPARE_PRICING_DATASET, Map.of("ticker", "SPY", "data", CSV, "ticker_id", 7), T0).validate();
        TaskEnvelope.create(TaskName.TASK_SCREENER_ANALYSIS, Map.of("universe", "SPY, qqq,IWM"), T0).validate();
    }

    @Test
    void ticker_publishing_tasks_get_a_lane() {
        TaskEnvelope prep = TaskEnvelope.create(TaskName.PREPARE_PRICING_DATASET, Map.of("ticker", "spy", "data", CSV), T0);
        TaskEnvelope algo = TaskEnvelope.create(TaskName.TASK_RUN_ALGO, Map.of("ticker", "spy", "algo", "buy_and_hold"), T0);
        assertEquals("SPY", prep.lane());
        assertNull(algo.lane());
    }

    @Test
    void requeue_increments_retry_count_and_delays() {
        TaskEnvelope env = TaskEnvelope.create(TaskName.GET_NEW_PRICING_DATA, Map.of("ticker", "SPY"), T0);
        TaskEnvelope again = env.requeued(T0, Duration.ofSeconds(5));
        assertEquals(env.taskId(), again.taskId());
        assertEquals(1, again.retryCount());
        assertFalse(again.isDue(T0));
        assertTrue(again.isDue(T0.plusSeconds(5)));
    }

    @Test
    void null_payload_values_are_dropped() {
        Map<String, Object> p = new HashMap<>();
        p.put("ticker", "SPY");
        p.put("start", null);
        TaskEnvelope env = TaskEnvelope.create(TaskName.GET_NEW_PRICING_DATA, p, T0);
        assertFalse(env.payload().containsKey("start"));
    }

    @Test
    void envelope_json_uses_wire_names() throws Exception {
        TaskEnvelope env = TaskEnvelope.create(TaskName.PUBLISH_FROM_S3_TO_REDIS, Map.of("ticker", "SPY", "redis_expire", 60), T0, "parent-1");
        String json = Json.mapper().writeValueAsString(env);
        assertTrue(json.contains("\"taskName\":\"publish_from_s3_to_redis\""), json);
        TaskEnvelope back = Json.mapper().readValue(json, TaskEnvelope.class);
        assertEquals(env.taskName(), back.taskName());
        assertEquals("parent-1", back.parentTaskId());
        assertEquals(60L, back.view().longValue("redis_expire", 0));
    }

    @Test
    void capability_lists_parse_wire_names() {
        assertEquals(TaskName.values().length, TaskName.parseSet("*").size());
        assertEquals(2, TaskName.parseSet("task_run_algo, prepare_pricing_dataset").size());
        assertThrows(InvalidPayloadException.class, () -> TaskName.parseSet("task_run_algo,nope"));
    }
}
