package io.pricingworkers.financial.yahoo;

import io.pricingworkers.financial.pricing.PriceBar;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Upstream market-data provider.
 */
public interface PricingClient {
    /** Daily bars for {@code [start, end]}, both inclusive. */
    List<PriceBar> fetchDaily(String ticker, LocalDate start, LocalDate end, String interval) throws IOException, InterruptedException;

    String source();
}
