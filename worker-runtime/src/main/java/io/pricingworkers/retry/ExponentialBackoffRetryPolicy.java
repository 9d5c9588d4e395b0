package io.pricingworkers.retry;

import io.pricingworkers.error.ErrorKind;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, long maxMillis) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    @Override
    public boolean shouldRetry(int retryCount, ErrorKind kind) {
        return kind != null && kind.retryable() && retryCount < maxRetries;
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    @Override
    public int maxRetries() { return maxRetries; }
}
