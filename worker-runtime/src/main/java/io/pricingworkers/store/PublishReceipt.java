package io.pricingworkers.store;

/**
 * Outcome of a publish. {@code cached=false} with {@code durable=true} means the cache tier is degraded.
 */
public record PublishReceipt(DatasetRef ref, boolean durable, boolean cached) {}
