package io.pricingworkers.financial.pricing;

import java.time.LocalDate;
import java.util.List;

/**
 * Prepared per-ticker dataset as published under {@code pricing/{TICKER}_latest}.
 *
 * @param asOf date of the last row
 * @param gaps US equity trading days missing between the first and last row
 */
public record PricingDataset(String ticker,
                             long tickerId,
                             String source,
                             LocalDate asOf,
                             LocalDate start,
                             LocalDate end,
                             int filledRows,
                             List<LocalDate> gaps,
                             List<PricingRow> rows) {

    public PricingDataset {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int size() { return rows.size(); }

    public PricingRow last() { return rows.get(rows.size() - 1); }
}
