package io.pricingworkers.core;

public enum ResultStatus {
    SUCCESS, FAILED, RETRYING;

    public boolean terminal() { return this != RETRYING; }
}
