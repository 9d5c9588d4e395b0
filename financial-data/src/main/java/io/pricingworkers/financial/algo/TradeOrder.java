package io.pricingworkers.financial.algo;

import java.time.LocalDate;

/**
 * @param balance account balance after the order (unchanged when rejected)
 */
public record TradeOrder(LocalDate date, Side side, Status status, long shares, double price, double balance,
                         double commission, String reason) {
    public enum Side { BUY, SELL }

    public enum Status { FILLED, REJECTED }
}
