package io.pricingworkers.error;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown inside stage logic; converted into a {@link StageError} before it crosses the worker boundary.
 */
public class StageException extends RuntimeException {
    private final ErrorKind kind;
    private final String code;
    private final Map<String, String> details = new LinkedHashMap<>();
    private Duration softWait;

    public StageException(ErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public StageException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public static StageException validation(String message) {
        return new StageException(ErrorKind.VALIDATION, "ValidationError", message);
    }

    public static StageException dataUnavailable(String code, String message) {
        return new StageException(ErrorKind.DATA_UNAVAILABLE, code, message);
    }

    public StageException detail(String key, Object value) {
        details.put(key, String.valueOf(value));
        return this;
    }

    public StageException softWait(Duration delay) {
        this.softWait = delay;
        return this;
    }

    public ErrorKind kind() { return kind; }
    public String code() { return code; }

    public StageError toError() {
        Map<String, String> d = new LinkedHashMap<>(details);
        if (getCause() != null) d.putIfAbsent("cause", StageError.safeMessage(getCause()));
        return new StageError(kind, code, StageError.safeMessage(this), d, softWait);
    }
}
