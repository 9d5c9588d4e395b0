package io.pricingworkers.broker;

import io.pricingworkers.core.ResultRecord;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryResultBackend implements ResultBackend {
    private final Map<String, ResultRecord> records = new ConcurrentHashMap<>();

    @Override
    public void record(ResultRecord result) {
        records.merge(result.taskId(), result, (old, neu) ->
                old.status().terminal() && !neu.status().terminal() ? old : neu);
    }

    @Override
    public Optional<ResultRecord> find(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    @Override
    public boolean ping() { return true; }

    public int size() { return records.size(); }
}
