package io.pricingworkers.error;

/**
 * Failure taxonomy. The worker decides retry vs report purely from the kind.
 */
public enum ErrorKind {
    /** Bad payload or request; retrying cannot help. */
    VALIDATION(false),
    /** Store or broker temporarily unreachable; retried with backoff up to the retry limit. */
    TRANSIENT_INFRA(true),
    /** An upstream dataset has not been produced yet; requeued once when the error asks for a soft wait. */
    DATA_UNAVAILABLE(false),
    /** The algorithm capability raised. */
    ALGORITHM(false),
    /** Anything a stage failed to classify. */
    UNEXPECTED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) { this.retryable = retryable; }

    public boolean retryable() { return retryable; }
}
