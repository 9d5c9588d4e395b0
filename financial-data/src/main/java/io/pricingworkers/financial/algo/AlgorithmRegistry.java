package io.pricingworkers.financial.algo;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

public class AlgorithmRegistry {
    private final Map<String, Algorithm> byId = new TreeMap<>();

    public AlgorithmRegistry(Collection<? extends Algorithm> algorithms) {
        for (Algorithm a : algorithms) {
            if (byId.put(a.id(), a) != null) throw new IllegalArgumentException("duplicate algorithm id " + a.id());
        }
    }

    public static AlgorithmRegistry defaults() {
        return new AlgorithmRegistry(List.of(new BuyAndHold(), new SmaCross()));
    }

    public Optional<Algorithm> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id.trim()));
    }

    public Set<String> ids() { return byId.keySet(); }
}
