package io.pricingworkers.runtime;

import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.error.StageError;
import io.pricingworkers.store.DatasetRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Either a success (optional dataset, chained envelopes, summary) or a failure carrying a {@link StageError}.
 */
public final class StageResult {
    private final StageError error;
    private final DatasetRef resultRef;
    private final List<TaskEnvelope> followUps;
    private final Map<String, Object> summary;

    private StageResult(StageError error, DatasetRef resultRef, List<TaskEnvelope> followUps, Map<String, Object> summary) {
        this.error = error;
        this.resultRef = resultRef;
        this.followUps = Collections.unmodifiableList(followUps);
        this.summary = Collections.unmodifiableMap(summary);
    }

    public static StageResult success() { return new StageResult(null, null, List.of(), Map.of()); }

    public static StageResult success(DatasetRef ref) { return new StageResult(null, ref, List.of(), Map.of()); }

    public static StageResult failure(StageError error) { return new StageResult(error, null, List.of(), Map.of()); }

    public StageResult withFollowUp(TaskEnvelope envelope) {
        List<TaskEnvelope> next = new ArrayList<>(followUps);
        next.add(envelope);
        return new StageResult(error, resultRef, next, summary);
    }

    public StageResult withFollowUps(List<TaskEnvelope> envelopes) {
        List<TaskEnvelope> next = new ArrayList<>(followUps);
        next.addAll(envelopes);
        return new StageResult(error, resultRef, next, summary);
    }

    public StageResult withSummary(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(summary);
        next.put(key, value);
        return new StageResult(error, resultRef, followUps, next);
    }

    public boolean isSuccess() { return error == null; }
    public StageError error() { return error; }
    public DatasetRef resultRef() { return resultRef; }
    public List<TaskEnvelope> followUps() { return followUps; }
    public Map<String, Object> summary() { return summary; }

    @Override
    public String toString() {
        return isSuccess()
                ? "StageResult{success ref=" + resultRef + " followUps=" + followUps.size() + "}"
                : "StageResult{failure " + error.kind() + "/" + error.code() + "}";
    }
}
