package io.pricingworkers.financial.algo;

import io.pricingworkers.financial.pricing.PricingRow;

import java.util.List;

/** Buys on the first row and holds. */
public class BuyAndHold extends TradingAlgorithm {
    public static final String ID = "buy_and_hold";

    @Override
    public String id() { return ID; }

    @Override
    protected void onRow(Account account, List<PricingRow> rows, int index) {
        if (index == 0) account.buy("initial position");
    }
}
