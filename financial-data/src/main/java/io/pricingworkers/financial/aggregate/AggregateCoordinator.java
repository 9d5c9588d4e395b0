package io.pricingworkers.financial.aggregate;

import io.pricingworkers.financial.pricing.PricingDataset;
import io.pricingworkers.financial.pricing.PricingRow;
import io.pricingworkers.store.DatasetKey;
import io.pricingworkers.store.DatasetRef;
import io.pricingworkers.store.DatasetNotFoundException;
import io.pricingworkers.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Reads prepared datasets for many tickers in parallel and compiles whatever arrives before the deadline.
 * Tickers that are missing, failing or late are skipped and reported rather than waited on.
 *
 * <p>Owns its reader executor; {@link #close} shuts it down.
 */
public class AggregateCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AggregateCoordinator.class);

    private final DatasetStore store;
    private final ExecutorService executor;
    private final Duration wait;
    private final Clock clock;

    public AggregateCoordinator(DatasetStore store, ExecutorService executor, Duration wait, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.wait = wait;
        this.clock = clock;
    }

    public AggregateDataset compile(Set<String> tickers) throws InterruptedException {
        List<String> sorted = new ArrayList<>(new TreeSet<>(tickers));
        List<Callable<DatasetStore.Fetched<PricingDataset>>> reads = new ArrayList<>();
        for (String t : sorted) {
            reads.add(() -> store.fetchEntry(DatasetKey.pricingLatest(t), PricingDataset.class));
        }
        // invokeAll cancels whatever has not finished when the wait elapses
        List<Future<DatasetStore.Fetched<PricingDataset>>> futures = executor.invokeAll(reads, wait.toMillis(), TimeUnit.MILLISECONDS);

        SortedMap<String, DatasetRef> refs = new TreeMap<>();
        SortedMap<String, String> skipped = new TreeMap<>();
        SortedMap<String, List<PricingRow>> series = new TreeMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            String ticker = sorted.get(i);
            try {
                DatasetStore.Fetched<PricingDataset> f = futures.get(i).get();
                refs.put(ticker, f.ref());
                series.put(ticker, f.value().rows());
            } catch (CancellationException e) {
                skipped.put(ticker, "timeout after " + wait.toMillis() + "ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof DatasetNotFoundException) {
                    skipped.put(ticker, "missing");
                } else {
                    log.warn("aggregate read failed ticker={}: {}", ticker, cause.toString());
                    skipped.put(ticker, "error: " + cause.getClass().getSimpleName());
                }
            }
        }
        if (!skipped.isEmpty()) log.info("aggregate partial included={} skipped={}", refs.keySet(), skipped);
        return new AggregateDataset(sorted, clock.instant(), refs, skipped, series);
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdownNow();
        if (!executor.awaitTermination(wait.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
            log.warn("aggregate readers still running after shutdown");
        }
    }

    @Override
    public String toString() { return "AggregateCoordinator"; }
}
