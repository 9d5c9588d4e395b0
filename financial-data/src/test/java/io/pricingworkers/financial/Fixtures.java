package io.pricingworkers.financial;

import io.pricingworkers.financial.pricing.PriceBar;
import io.pricingworkers.financial.pricing.PricingCsv;
import io.pricingworkers.financial.pricing.PricingDataset;
import io.pricingworkers.financial.pricing.PricingNormalizer;
import io.pricingworkers.financial.pricing.TradingCalendars;
import io.pricingworkers.metrics.Metrics;
import io.pricingworkers.store.DatasetCodec;
import io.pricingworkers.store.DatasetStore;
import io.pricingworkers.store.InMemoryKeyValueCache;
import io.pricingworkers.store.InMemoryObjectStore;
import io.pricingworkers.store.ObjectStore;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {
    public static final LocalDate FIRST_DAY = LocalDate.of(2024, 1, 2);

    private Fixtures() {}

    /** {@code n} consecutive trading days from {@code from} with a rising close. */
    public static List<PriceBar> bars(LocalDate from, int n, double firstClose) {
        List<PriceBar> out = new ArrayList<>();
        LocalDate d = from;
        while (out.size() < n) {
            if (TradingCalendars.isUsEquityTradingDay(d)) {
                double c = firstClose + out.size();
                out.add(new PriceBar(d, c - 0.5, c + 1, c - 1, c, 1_000L + out.size()));
            }
            d = d.plusDays(1);
        }
        return out;
    }

    public static String csv(int n) {
        return PricingCsv.formatBars(bars(FIRST_DAY, n, 100));
    }

    public static PricingDataset dataset(String ticker, int n, double firstClose) {
        List<PriceBar> bars = bars(FIRST_DAY, n, firstClose);
        PricingNormalizer.Normalized norm = PricingNormalizer.normalize(bars, null, null);
        LocalDate last = bars.get(bars.size() - 1).date();
        return new PricingDataset(ticker, 1, "test", last, FIRST_DAY, last, 0, norm.gaps(), norm.rows());
    }

    public static DatasetStore store(ObjectStore objects, Clock clock) {
        return new DatasetStore(objects, new InMemoryKeyValueCache(0, clock), new DatasetCodec(),
                Duration.ofMinutes(5), true, true, Metrics.standalone());
    }

    public static DatasetStore store(Clock clock) {
        return store(new InMemoryObjectStore(), clock);
    }
}
