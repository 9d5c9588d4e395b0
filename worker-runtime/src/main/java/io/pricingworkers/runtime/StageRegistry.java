package io.pricingworkers.runtime;

import io.pricingworkers.core.TaskName;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class StageRegistry {
    private final Map<TaskName, Stage> stages = new EnumMap<>(TaskName.class);

    public StageRegistry(Collection<? extends Stage> stages) {
        for (Stage s : stages) {
            Stage prev = this.stages.put(s.taskName(), s);
            if (prev != null) throw new IllegalArgumentException("two stages registered for " + s.taskName());
        }
    }

    public Optional<Stage> get(TaskName name) { return Optional.ofNullable(stages.get(name)); }

    public Set<TaskName> taskNames() {
        return stages.isEmpty() ? EnumSet.noneOf(TaskName.class) : EnumSet.copyOf(stages.keySet());
    }

    /** Requested capabilities restricted to the operations this registry can run. */
    public Set<TaskName> supported(Set<TaskName> requested) {
        Set<TaskName> out = EnumSet.noneOf(TaskName.class);
        for (TaskName t : requested) if (stages.containsKey(t)) out.add(t);
        return out;
    }
}
