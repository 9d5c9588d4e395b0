package io.pricingworkers.broker;

/**
 * The broker or backend channel could not be reached. Callers retry with backoff.
 */
public class BrokerUnavailableException extends Exception {
    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
