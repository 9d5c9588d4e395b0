package io.pricingworkers.core;

import io.pricingworkers.error.StageError;
import io.pricingworkers.store.DatasetRef;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Outcome of one task as written to the backend channel. A RETRYING record is overwritten by the terminal one.
 */
public record ResultRecord(String taskId,
                           TaskName taskName,
                           ResultStatus status,
                           DatasetRef resultRef,
                           StageError error,
                           Map<String, Object> summary,
                           int retryCount,
                           Instant completedAt) {

    public ResultRecord {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        Map<String, Object> copy = new TreeMap<>();
        if (summary != null) summary.forEach((k, v) -> { if (k != null && v != null) copy.put(k, v); });
        summary = Collections.unmodifiableMap(copy);
    }

    public static ResultRecord success(TaskEnvelope env, DatasetRef ref, Map<String, Object> summary, Instant at) {
        return new ResultRecord(env.taskId(), env.taskName(), ResultStatus.SUCCESS, ref, null, summary, env.retryCount(), at);
    }

    public static ResultRecord failed(TaskEnvelope env, StageError error, Instant at) {
        return new ResultRecord(env.taskId(), env.taskName(), ResultStatus.FAILED, null, error, Map.of(), env.retryCount(), at);
    }

    public static ResultRecord retrying(TaskEnvelope env, StageError error, Instant at) {
        return new ResultRecord(env.taskId(), env.taskName(), ResultStatus.RETRYING, null, error, Map.of(), env.retryCount(), at);
    }
}
