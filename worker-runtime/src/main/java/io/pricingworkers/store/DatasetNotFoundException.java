package io.pricingworkers.store;

public class DatasetNotFoundException extends RuntimeException {
    private final DatasetKey key;

    public DatasetNotFoundException(DatasetKey key) {
        super("dataset not found in any tier: " + key);
        this.key = key;
    }

    public DatasetKey key() { return key; }
}
