package io.pricingworkers.error;

/**
 * Invalid startup configuration. Fatal for the process.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
