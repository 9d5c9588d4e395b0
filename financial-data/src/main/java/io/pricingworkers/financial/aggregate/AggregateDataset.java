package io.pricingworkers.financial.aggregate;

import io.pricingworkers.financial.pricing.PricingRow;
import io.pricingworkers.store.DatasetRef;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Multi-ticker compilation published under {@code compileddatasets/...}.
 *
 * @param tickers requested tickers, sorted
 * @param refs    dataset version each included ticker was read at
 * @param skipped reason per requested ticker that is not included
 */
public record AggregateDataset(List<String> tickers,
                               Instant compiledAt,
                               SortedMap<String, DatasetRef> refs,
                               SortedMap<String, String> skipped,
                               SortedMap<String, List<PricingRow>> series) {

    public AggregateDataset {
        tickers = List.copyOf(tickers);
        refs = new TreeMap<>(refs);
        skipped = new TreeMap<>(skipped);
        series = new TreeMap<>(series);
    }

    public boolean partial() { return !skipped.isEmpty(); }

    public boolean empty() { return refs.isEmpty(); }

    public Map<String, Object> summary() {
        return Map.of("tickers", tickers.size(), "included", refs.size(), "skipped", skipped.keySet());
    }
}
