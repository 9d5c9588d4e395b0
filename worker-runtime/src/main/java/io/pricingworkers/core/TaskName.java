package io.pricingworkers.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.pricingworkers.core.FieldType.*;

/**
 * The fixed set of operations workers can execute. Wire names are what producers and brokers carry.
 */
public enum TaskName {
    GET_NEW_PRICING_DATA("get_new_pricing_data", false, PayloadSchema.builder()
            .required("ticker", TICKER)
            .optional("ticker_id", INTEGER)
            .optional("start", DATE)
            .optional("end", DATE)
            .optional("interval", STRING)
            .build()),
    HANDLE_PRICING_UPDATE_TASK("handle_pricing_update_task", true, PayloadSchema.builder()
            .required("ticker", TICKER)
            .required("data", CSV)
            .optional("ticker_id", INTEGER)
            .optional("source", STRING)
            .optional("run_algo", STRING)
            .build()),
    PREPARE_PRICING_DATASET("prepare_pricing_dataset", true, PayloadSchema.builder()
            .required("ticker", TICKER)
            .required("data", CSV)
            .optional("ticker_id", INTEGER)
            .optional("start", DATE)
            .optional("end", DATE)
            .optional("source", STRING)
            .optional("run_algo", STRING)
            .build()),
    PUBLISH_FROM_S3_TO_REDIS("publish_from_s3_to_redis", false, PayloadSchema.builder()
            .required("ticker", TICKER)
            .optional("s3_bucket", STRING)
            .optional("s3_key", STRING)
            .optional("redis_key", STRING)
            .optional("redis_expire", INTEGER)
            .build()),
    PUBLISH_PRICING_UPDATE("publish_pricing_update", true, PayloadSchema.builder()
            .required("ticker", TICKER)
            .optional("ticker_id", INTEGER)
            .optional("data", CSV)
            .optional("s3_bucket", STRING)
            .optional("s3_key", STRING)
            .optional("redis_key", STRING)
            .optional("s3_enabled", BOOLEAN)
            .optional("redis_enabled", BOOLEAN)
            .optional("redis_expire", INTEGER)
            .optional("from_cache", BOOLEAN)
            .optional("updated", STRING)
            .build()),
    TASK_SCREENER_ANALYSIS("task_screener_analysis", false, PayloadSchema.builder()
            .required("universe", TICKER_LIST)
            .optional("min_rows", INTEGER)
            .optional("min_close", DECIMAL)
            .optional("max_close", DECIMAL)
            .optional("algo", STRING)
            .build()),
    PUBLISH_TICKER_AGGREGATE_FROM_S3("publish_ticker_aggregate_from_s3", false, PayloadSchema.builder()
            .required("tickers", TICKER_LIST)
            .optional("s3_key", STRING)
            .build()),
    TASK_RUN_ALGO("task_run_algo", false, PayloadSchema.builder()
            .required("ticker", TICKER)
            .required("algo", STRING)
            .optional("balance", DECIMAL)
            .optional("commission", DECIMAL)
            .build());

    private static final Map<String, TaskName> BY_WIRE = Arrays.stream(values())
            .collect(Collectors.toMap(TaskName::wireName, Function.identity()));

    private final String wireName;
    private final boolean tickerLane;
    private final PayloadSchema schema;

    TaskName(String wireName, boolean tickerLane, PayloadSchema schema) {
        this.wireName = wireName;
        this.tickerLane = tickerLane;
        this.schema = schema;
    }

    @JsonValue
    public String wireName() { return wireName; }
    public PayloadSchema schema() { return schema; }

    /** Tasks that write a ticker's own keys are serialized per ticker by the broker. */
    public boolean tickerLane() { return tickerLane; }

    @JsonCreator
    public static TaskName fromWire(String name) {
        TaskName t = name == null ? null : BY_WIRE.get(name.trim());
        if (t == null) throw new InvalidPayloadException("unknown task_name: " + name);
        return t;
    }

    public static Set<TaskName> parseSet(String csv) {
        if (csv == null || csv.isBlank() || csv.trim().equals("*")) return EnumSet.allOf(TaskName.class);
        EnumSet<TaskName> out = EnumSet.noneOf(TaskName.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) out.add(fromWire(part));
        }
        return out;
    }

    @Override
    public String toString() { return wireName; }
}
