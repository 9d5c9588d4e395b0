package io.pricingworkers.financial.yahoo;

import com.codahale.metrics.Counter;
import io.pricingworkers.financial.pricing.PriceBar;
import io.pricingworkers.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class YahooPricingClient implements PricingClient {
    private static final Logger log = LoggerFactory.getLogger(YahooPricingClient.class);

    private final YahooClient client;
    private final YahooChartParser parser = new YahooChartParser();
    private final Map<String, Integer> consecutiveFailures = new ConcurrentHashMap<>();
    private final Counter windows;
    private final Counter failures;
    private final Counter zeroRows;

    public YahooPricingClient(YahooClient client, Metrics metrics) {
        this.client = client;
        this.windows = metrics.counter("yahoo.fetch.windows");
        this.failures = metrics.counter("yahoo.fetch.failures");
        this.zeroRows = metrics.counter("yahoo.fetch.zeroRows");
    }

    @Override
    public String source() { return "yahoo"; }

    @Override
    public List<PriceBar> fetchDaily(String ticker, LocalDate start, LocalDate end, String interval) throws IOException, InterruptedException {
        long p1 = start.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        long p2 = end.plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC) - 1;
        windows.inc();
        List<PriceBar> bars;
        try {
            bars = parser.parse(client.fetch(ticker, p1, p2, interval));
        } catch (IOException e) {
            failures.inc();
            int streak = consecutiveFailures.merge(ticker, 1, Integer::sum);
            if (streak % 5 == 0) {
                log.warn("yahoo failures streak={} ticker={} window={}..{}: {}", streak, ticker, start, end, e.getMessage());
            }
            throw e;
        }
        consecutiveFailures.remove(ticker);
        List<PriceBar> inRange = new ArrayList<>(bars.size());
        for (PriceBar b : bars) {
            if (!b.date().isBefore(start) && !b.date().isAfter(end)) inRange.add(b);
        }
        if (inRange.isEmpty()) zeroRows.inc();
        log.debug("yahoo ticker={} window={}..{} rows={}", ticker, start, end, inRange.size());
        return inRange;
    }
}
