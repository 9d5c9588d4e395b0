package io.pricingworkers.financial.algo;

import java.time.LocalDate;
import java.util.List;

/**
 * Published under {@code algoreport/{TICKER}_{algo}_latest}. {@code created} and {@code updated} are the first and
 * last dataset dates processed, so re-running on the same dataset yields the same report.
 */
public record AlgorithmReport(String name,
                              String ticker,
                              LocalDate created,
                              LocalDate updated,
                              List<TradeOrder> buys,
                              List<TradeOrder> sells,
                              int numProcessed,
                              List<HistoryEntry> history,
                              double balance,
                              double startingBalance,
                              double commission,
                              long openShares) {

    public AlgorithmReport {
        buys = List.copyOf(buys);
        sells = List.copyOf(sells);
        history = List.copyOf(history);
    }
}
