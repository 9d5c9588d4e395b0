package io.pricingworkers.financial.pricing;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns parsed bars into a clean ascending series: range filter, one bar per date (last one wins),
 * missing prices carried from the previous close, and trading-day gaps recorded.
 */
public final class PricingNormalizer {
    private PricingNormalizer() {}

    public record Normalized(List<PricingRow> rows, List<LocalDate> gaps, int filled, int duplicates, int dropped) {}

    /**
     * @param start inclusive lower bound, or null
     * @param end   inclusive upper bound, or null
     */
    public static Normalized normalize(List<PriceBar> bars, LocalDate start, LocalDate end) {
        Map<LocalDate, PriceBar> byDate = new TreeMap<>();
        int duplicates = 0;
        for (PriceBar b : bars) {
            if (start != null && b.date().isBefore(start)) continue;
            if (end != null && b.date().isAfter(end)) continue;
            if (byDate.put(b.date(), b) != null) duplicates++;
        }

        List<PricingRow> rows = new ArrayList<>(byDate.size());
        Double prevClose = null;
        int filled = 0;
        int dropped = 0;
        for (PriceBar b : byDate.values()) {
            Double close = b.close() != null ? b.close() : prevClose;
            if (close == null) {
                dropped++;
                continue;
            }
            double carry = prevClose != null ? prevClose : close;
            boolean wasFilled = b.close() == null || b.open() == null || b.high() == null || b.low() == null;
            rows.add(new PricingRow(b.date(),
                    b.open() != null ? b.open() : carry,
                    b.high() != null ? b.high() : Math.max(carry, close),
                    b.low() != null ? b.low() : Math.min(carry, close),
                    close,
                    b.volume() != null ? b.volume() : 0L,
                    wasFilled));
            if (wasFilled) filled++;
            prevClose = close;
        }

        List<LocalDate> gaps = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            gaps.addAll(TradingCalendars.tradingDaysBetween(rows.get(i - 1).date(), rows.get(i).date()));
        }
        return new Normalized(rows, gaps, filled, duplicates, dropped);
    }

    /** Merges two bar lists by date; bars from {@code incoming} replace existing bars on the same date. */
    public static List<PriceBar> merge(List<PriceBar> existing, List<PriceBar> incoming) {
        Map<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (PriceBar b : existing) byDate.put(b.date(), b);
        for (PriceBar b : incoming) byDate.put(b.date(), b);
        return new ArrayList<>(byDate.values());
    }
}
