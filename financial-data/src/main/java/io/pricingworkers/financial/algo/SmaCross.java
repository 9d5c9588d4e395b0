package io.pricingworkers.financial.algo;

import io.pricingworkers.financial.pricing.PricingRow;

import java.util.List;

/**
 * Buys when the fast simple moving average of the close crosses above the slow one, sells on the cross below.
 */
public class SmaCross extends TradingAlgorithm {
    public static final String ID = "sma_cross";

    private final int fast;
    private final int slow;

    public SmaCross() { this(5, 20); }

    public SmaCross(int fast, int slow) {
        if (fast < 1 || slow <= fast) throw new IllegalArgumentException("need 1 <= fast < slow, got " + fast + "/" + slow);
        this.fast = fast;
        this.slow = slow;
    }

    @Override
    public String id() { return ID; }

    @Override
    protected void onRow(Account account, List<PricingRow> rows, int index) {
        if (index < slow) return;
        double fastNow = sma(rows, index, fast);
        double slowNow = sma(rows, index, slow);
        double fastPrev = sma(rows, index - 1, fast);
        double slowPrev = sma(rows, index - 1, slow);
        if (fastPrev <= slowPrev && fastNow > slowNow && !account.holding()) {
            account.buy("sma" + fast + " crossed above sma" + slow);
        } else if (fastPrev >= slowPrev && fastNow < slowNow && account.holding()) {
            account.sell("sma" + fast + " crossed below sma" + slow);
        }
    }

    static double sma(List<PricingRow> rows, int end, int window) {
        double sum = 0;
        for (int i = end - window + 1; i <= end; i++) sum += rows.get(i).close();
        return sum / window;
    }
}
