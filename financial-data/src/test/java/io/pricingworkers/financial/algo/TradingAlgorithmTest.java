package io.pricingworkers.financial.algo;

import io.pricingworkers.financial.pricing.PricingRow;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradingAlgorithmTest {
    private static final LocalDate DAY0 = LocalDate.of(2024, 1, 1);

    static List<PricingRow> rows(double... closes) {
        List<PricingRow> out = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            out.add(new PricingRow(DAY0.plusDays(i), closes[i], closes[i], closes[i], closes[i], 1000, false));
        }
        return out;
    }

    @Test
    void buy_and_hold_spends_balance_minus_commission_on_whole_shares() {
        AlgorithmReport r = new BuyAndHold().run(new AlgorithmInput("SPY", rows(10, 11, 12), 1000, 6));

        assertEquals(1, r.buys().size());
        TradeOrder buy = r.buys().get(0);
        assertEquals(TradeOrder.Status.FILLED, buy.status());
        assertEquals(99, buy.shares());
        assertEquals(4.0, r.balance(), 1e-9);
        assertEquals(99, r.openShares());
        assertEquals(1000.0, r.startingBalance());
        assertEquals(3, r.numProcessed());
        assertEquals(DAY0, r.created());
        assertEquals(DAY0.plusDays(2), r.updated());

        HistoryEntry last = r.history().get(2);
        assertEquals(4.0 + 99 * 12, last.equity(), 1e-9);
        assertEquals(1, last.totalBuys());
        HistoryEntry first = r.history().get(0);
        assertEquals(1000.0, first.prevBalance());
        assertEquals(0, first.prevShares());
    }

    @Test
    void buy_without_funds_for_one_share_is_rejected_and_balance_unchanged() {
        AlgorithmReport r = new BuyAndHold().run(new AlgorithmInput("BRK-A", rows(500_000), 10_000, 6));
        TradeOrder buy = r.buys().get(0);
        assertEquals(TradeOrder.Status.REJECTED, buy.status());
        assertEquals(0, buy.shares());
        assertEquals(10_000.0, r.balance());
        assertEquals(0, r.openShares());
    }

    @Test
    void sma_cross_buys_on_upward_cross_and_sells_on_downward_cross() {
        List<PricingRow> rows = rows(5, 4, 3, 2, 1, 2, 3, 4, 5, 4, 3, 2, 1);
        AlgorithmReport r = new SmaCross(2, 3).run(new AlgorithmInput("SPY", rows, 1000, 1));

        assertEquals(1, r.buys().size());
        assertEquals(1, r.sells().size());
        assertEquals(DAY0.plusDays(6), r.buys().get(0).date());
        assertEquals(333, r.buys().get(0).shares());
        assertEquals(DAY0.plusDays(10), r.sells().get(0).date());
        assertEquals(333, r.sells().get(0).shares());
        assertEquals(998.0, r.balance(), 1e-9);
        assertEquals(0, r.openShares());
    }

    @Test
    void runs_are_independent_and_deterministic() {
        Algorithm algo = new SmaCross(2, 3);
        AlgorithmInput input = new AlgorithmInput("SPY", rows(5, 4, 3, 2, 1, 2, 3, 4, 5, 4, 3, 2, 1), 1000, 1);
        assertEquals(algo.run(input), algo.run(input));
    }

    @Test
    void invalid_windows_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new SmaCross(5, 5));
        assertThrows(IllegalArgumentException.class, () -> new SmaCross(0, 3));
    }

    @Test
    void registry_finds_by_trimmed_id_and_rejects_duplicates() {
        AlgorithmRegistry registry = AlgorithmRegistry.defaults();
        assertTrue(registry.find(" sma_cross ").isPresent());
        assertTrue(registry.find("martingale").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertEquals(List.of("buy_and_hold", "sma_cross"), List.copyOf(registry.ids()));
        assertThrows(IllegalArgumentException.class, () -> new AlgorithmRegistry(List.of(new BuyAndHold(), new BuyAndHold())));
    }
}
