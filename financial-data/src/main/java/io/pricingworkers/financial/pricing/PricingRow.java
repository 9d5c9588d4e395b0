package io.pricingworkers.financial.pricing;

import java.time.LocalDate;

/**
 * Normalized daily bar. {@code filled} marks rows where a missing price was carried from the previous close.
 */
public record PricingRow(LocalDate date, double open, double high, double low, double close, long volume, boolean filled) {}
