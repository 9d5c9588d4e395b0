package io.pricingworkers.financial.algo;

import io.pricingworkers.financial.pricing.PricingRow;

import java.util.List;

public record AlgorithmInput(String ticker, List<PricingRow> rows, double balance, double commission) {
    public static final double DEFAULT_BALANCE = 10_000.0;
    public static final double DEFAULT_COMMISSION = 6.0;

    public AlgorithmInput {
        rows = List.copyOf(rows);
    }
}
