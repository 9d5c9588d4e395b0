package io.pricingworkers.retry;

import io.pricingworkers.error.ErrorKind;

public interface RetryPolicy {
    /** @param retryCount retries already spent on the envelope */
    boolean shouldRetry(int retryCount, ErrorKind kind);

    /** @param attempt 1 for the first retry */
    long backoffMillis(int attempt);

    int maxRetries();
}
