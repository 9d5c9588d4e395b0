package io.pricingworkers.runtime;

import io.pricingworkers.core.TaskName;

/**
 * One pipeline operation. Implementations must be idempotent: executing the same envelope twice leaves the
 * stores in the same state as executing it once.
 */
public interface Stage {
    TaskName taskName();

    /**
     * Runs the operation. Failures should come back as {@link StageResult#failure}; anything thrown is
     * classified by the worker as unexpected.
     */
    StageResult execute(StageContext context);
}
