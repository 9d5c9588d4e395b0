package io.pricingworkers.error;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured failure carried in stage results and result records.
 *
 * @param code     stable short identifier, e.g. {@code InsufficientData}
 * @param softWait when set on a {@link ErrorKind#DATA_UNAVAILABLE} error, the envelope is requeued once after this delay
 */
public record StageError(ErrorKind kind, String code, String message, Map<String, String> details, Duration softWait) {

    public StageError {
        details = details == null ? Map.of() : java.util.Collections.unmodifiableMap(new TreeMap<>(details));
    }

    public static StageError of(ErrorKind kind, String code, String message) {
        return new StageError(kind, code, message, Map.of(), null);
    }

    public static StageError fromException(Throwable t) {
        if (t instanceof StageException se) return se.toError();
        if (t instanceof TransientInfraException) {
            return new StageError(ErrorKind.TRANSIENT_INFRA, "TransientInfraError", safeMessage(t), Map.of("exception", t.getClass().getName()), null);
        }
        return new StageError(ErrorKind.UNEXPECTED, t.getClass().getSimpleName(), safeMessage(t), Map.of("exception", t.getClass().getName()), null);
    }

    public StageError withDetail(String key, String value) {
        Map<String, String> copy = new TreeMap<>(details);
        copy.put(key, value);
        return new StageError(kind, code, message, copy, softWait);
    }

    static String safeMessage(Throwable t) {
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) msg = t.getClass().getSimpleName();
        if (msg.length() > 500) msg = msg.substring(0, 500);
        return msg;
    }
}
