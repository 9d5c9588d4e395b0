package io.pricingworkers.financial.pricing;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PricingNormalizerTest {

    private static PriceBar bar(String date, Double close) {
        return new PriceBar(LocalDate.parse(date), close, close, close, close, 100L);
    }

    @Test
    void sorts_dedupes_and_keeps_the_last_bar_per_date() {
        PricingNormalizer.Normalized n = PricingNormalizer.normalize(List.of(
                bar("2024-01-04", 3.0), bar("2024-01-02", 1.0), bar("2024-01-03", 2.0), bar("2024-01-02", 1.5)), null, null);
        assertEquals(List.of(LocalDate.parse("2024-01-02"), LocalDate.parse("2024-01-03"), LocalDate.parse("2024-01-04")),
                n.rows().stream().map(PricingRow::date).toList());
        assertEquals(1.5, n.rows().get(0).close());
        assertEquals(1, n.duplicates());
    }

    @Test
    void fills_missing_prices_from_previous_close_and_flags_the_row() {
        PriceBar partial = new PriceBar(LocalDate.parse("2024-01-03"), null, null, null, null, null);
        PricingNormalizer.Normalized n = PricingNormalizer.normalize(List.of(bar("2024-01-02", 10.0), partial), null, null);
        PricingRow filled = n.rows().get(1);
        assertTrue(filled.filled());
        assertEquals(10.0, filled.close());
        assertEquals(10.0, filled.open());
        assertEquals(0L, filled.volume());
        assertEquals(1, n.filled());
        assertFalse(n.rows().get(0).filled());
    }

    @Test
    void leading_rows_without_any_close_are_dropped() {
        PriceBar empty = new PriceBar(LocalDate.parse("2024-01-02"), 1.0, null, null, null, null);
        PricingNormalizer.Normalized n = PricingNormalizer.normalize(List.of(empty, bar("2024-01-03", 2.0)), null, null);
        assertEquals(1, n.rows().size());
        assertEquals(1, n.dropped());
    }

    @Test
    void filters_to_inclusive_range_and_records_trading_day_gaps() {
        PricingNormalizer.Normalized n = PricingNormalizer.normalize(List.of(
                bar("2023-12-29", 1.0), bar("2024-01-02", 2.0), bar("2024-01-05", 3.0), bar("2024-01-08", 4.0)),
                LocalDate.parse("2024-01-01"), LocalDate.parse("2024-01-05"));
        assertEquals(2, n.rows().size());
        // Jan 3 and 4 are trading days; nothing else is missing between Jan 2 and Jan 5
        assertEquals(List.of(LocalDate.parse("2024-01-03"), LocalDate.parse("2024-01-04")), n.gaps());
    }

    @Test
    void merge_lets_incoming_bars_replace_existing_ones() {
        List<PriceBar> merged = PricingNormalizer.merge(
                List.of(bar("2024-01-02", 1.0), bar("2024-01-03", 2.0)),
                List.of(bar("2024-01-03", 20.0), bar("2024-01-04", 30.0)));
        assertEquals(List.of(1.0, 20.0, 30.0), merged.stream().map(PriceBar::close).toList());
    }
}
