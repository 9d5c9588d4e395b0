package io.pricingworkers.financial.algo;

/**
 * A trading algorithm run over one prepared dataset. Implementations are pure: same input, same report.
 */
public interface Algorithm {
    String id();

    AlgorithmReport run(AlgorithmInput input);
}
