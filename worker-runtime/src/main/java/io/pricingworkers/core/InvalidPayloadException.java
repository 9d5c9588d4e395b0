package io.pricingworkers.core;

/**
 * Envelope rejected before dispatch: unknown task name or payload that fails its schema. Never retried.
 */
public class InvalidPayloadException extends RuntimeException {
    public InvalidPayloadException(String message) {
        super(message);
    }
}
