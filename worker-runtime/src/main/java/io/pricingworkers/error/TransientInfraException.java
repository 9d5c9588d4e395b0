package io.pricingworkers.error;

/**
 * A store or channel was temporarily unreachable. Safe to retry.
 */
public class TransientInfraException extends RuntimeException {
    public TransientInfraException(String message) {
        super(message);
    }

    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }
}
