package io.pricingworkers.financial.pricing;

import java.time.LocalDate;

/**
 * One parsed CSV row before normalization. Any price or the volume may be missing.
 */
public record PriceBar(LocalDate date, Double open, Double high, Double low, Double close, Long volume) {}
