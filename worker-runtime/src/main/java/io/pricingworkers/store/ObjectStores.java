package io.pricingworkers.store;

import io.pricingworkers.error.ConfigurationException;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens an object store from its endpoint: {@code file:<dir>} or {@code memory:}.
 */
public final class ObjectStores {
    private ObjectStores() {}

    public static ObjectStore open(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) throw new ConfigurationException("object store endpoint is empty");
        String e = endpoint.trim();
        if (e.startsWith("memory:")) return new InMemoryObjectStore();
        if (e.startsWith("file:")) {
            String dir = e.substring("file:".length());
            if (dir.startsWith("//")) dir = dir.substring(2);
            if (dir.isBlank()) throw new ConfigurationException("object store endpoint has no directory: " + endpoint);
            try {
                return new FileObjectStore(Path.of(dir));
            } catch (IOException ex) {
                throw new ConfigurationException("cannot create object store root " + dir, ex);
            }
        }
        throw new ConfigurationException("unsupported object store endpoint: " + endpoint);
    }
}
