package io.pricingworkers.financial.algo;

import java.time.LocalDate;

/** Account state after processing one row. */
public record HistoryEntry(LocalDate date, double close, double balance, long shares, double prevBalance,
                           long prevShares, int totalBuys, int totalSells, double equity) {}
