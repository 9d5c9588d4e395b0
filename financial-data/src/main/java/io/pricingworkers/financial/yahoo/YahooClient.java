package io.pricingworkers.financial.yahoo;

import java.io.IOException;

/**
 * Raw access to the Yahoo Finance v8 chart endpoint.
 */
public interface YahooClient {
    /** @return the chart JSON body for {@code [period1, period2]} in epoch seconds */
    String fetch(String ticker, long period1, long period2, String interval) throws IOException, InterruptedException;
}
