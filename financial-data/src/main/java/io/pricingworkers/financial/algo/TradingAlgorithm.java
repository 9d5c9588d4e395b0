package io.pricingworkers.financial.algo;

import io.pricingworkers.financial.pricing.PricingRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for algorithms that trade one ticker at the daily close. Each run gets a fresh {@link Account}, so one
 * instance can serve concurrent workers.
 */
public abstract class TradingAlgorithm implements Algorithm {
    private static final Logger log = LoggerFactory.getLogger(TradingAlgorithm.class);

    /** Called once per row in date order. */
    protected abstract void onRow(Account account, List<PricingRow> rows, int index);

    @Override
    public final AlgorithmReport run(AlgorithmInput input) {
        Account account = new Account(input.balance(), input.commission());
        List<PricingRow> rows = input.rows();
        for (int i = 0; i < rows.size(); i++) {
            account.beginRow(rows.get(i));
            onRow(account, rows, i);
            account.endRow();
        }
        log.info("{} ticker={} rows={} buys={} sells={} balance={} shares={}", id(), input.ticker(), rows.size(),
                account.buys.size(), account.sells.size(), account.balance, account.shares);
        return new AlgorithmReport(id(), input.ticker(),
                rows.isEmpty() ? null : rows.get(0).date(),
                rows.isEmpty() ? null : rows.get(rows.size() - 1).date(),
                account.buys, account.sells, account.history.size(), account.history,
                account.balance, input.balance(), input.commission(), account.shares);
    }

    /**
     * Cash and position for one run. Buys spend the whole balance less commission on whole shares;
     * sells close the whole position.
     */
    public static final class Account {
        private final double commission;
        private final List<TradeOrder> buys = new ArrayList<>();
        private final List<TradeOrder> sells = new ArrayList<>();
        private final List<HistoryEntry> history = new ArrayList<>();
        private double balance;
        private long shares;
        private PricingRow row;
        private double prevBalance;
        private long prevShares;

        Account(double balance, double commission) {
            this.balance = balance;
            this.commission = commission;
        }

        public double balance() { return balance; }
        public long shares() { return shares; }
        public boolean holding() { return shares > 0; }

        public TradeOrder buy(String reason) {
            double price = row.close();
            long qty = price <= 0 ? 0 : (long) Math.floor((balance - commission) / price);
            TradeOrder order;
            if (qty < 1) {
                order = new TradeOrder(row.date(), TradeOrder.Side.BUY, TradeOrder.Status.REJECTED, 0, price, balance, commission,
                        "not enough funds: " + reason);
            } else {
                balance = balance - qty * price - commission;
                shares += qty;
                order = new TradeOrder(row.date(), TradeOrder.Side.BUY, TradeOrder.Status.FILLED, qty, price, balance, commission, reason);
            }
            buys.add(order);
            return order;
        }

        public TradeOrder sell(String reason) {
            double price = row.close();
            TradeOrder order;
            if (shares < 1) {
                order = new TradeOrder(row.date(), TradeOrder.Side.SELL, TradeOrder.Status.REJECTED, 0, price, balance, commission,
                        "no shares to sell: " + reason);
            } else {
                long qty = shares;
                balance = balance + qty * price - commission;
                shares = 0;
                order = new TradeOrder(row.date(), TradeOrder.Side.SELL, TradeOrder.Status.FILLED, qty, price, balance, commission, reason);
            }
            sells.add(order);
            return order;
        }

        void beginRow(PricingRow r) {
            row = r;
            prevBalance = balance;
            prevShares = shares;
        }

        void endRow() {
            history.add(new HistoryEntry(row.date(), row.close(), balance, shares, prevBalance, prevShares,
                    buys.size(), sells.size(), balance + shares * row.close()));
        }
    }
}
