package io.pricingworkers.financial.stage;

import io.pricingworkers.core.InvalidPayloadException;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.error.StageError;
import io.pricingworkers.error.StageException;
import io.pricingworkers.error.TransientInfraException;
import io.pricingworkers.runtime.Stage;
import io.pricingworkers.runtime.StageContext;
import io.pricingworkers.runtime.StageResult;
import io.pricingworkers.store.DatasetNotFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for the financial stages: stage bodies throw {@link StageException} and this turns the known failures
 * into {@link StageResult#failure} results. Rejected arguments, such as a bucket or key override that is not a
 * valid dataset address, are validation failures. Anything else propagates to the worker as unexpected.
 */
abstract class PricingStage implements Stage {
    private final TaskName taskName;

    PricingStage(TaskName taskName) {
        this.taskName = taskName;
    }

    @Override
    public final TaskName taskName() { return taskName; }

    @Override
    public final StageResult execute(StageContext context) {
        try {
            return run(context);
        } catch (StageException | TransientInfraException e) {
            return StageResult.failure(StageError.fromException(e));
        } catch (InvalidPayloadException e) {
            return StageResult.failure(StageError.of(ErrorKind.VALIDATION, "InvalidPayload", e.getMessage()));
        } catch (DatasetNotFoundException e) {
            return StageResult.failure(StageError.of(ErrorKind.DATA_UNAVAILABLE, "DatasetNotFound", e.getMessage())
                    .withDetail("dataset", e.key().toString()));
        } catch (IllegalArgumentException e) {
            return StageResult.failure(StageError.of(ErrorKind.VALIDATION, "InvalidArgument", e.getMessage()));
        }
    }

    protected abstract StageResult run(StageContext context);

    /** Payload for a chained task; null values are left out. */
    static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) out.put((String) keyValues[i], keyValues[i + 1]);
        }
        return out;
    }
}
