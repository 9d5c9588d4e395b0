package io.pricingworkers.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pricingworkers.core.Json;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic JSON encoding of dataset values: map keys are sorted, so equal values always produce equal bytes
 * and therefore equal versions.
 */
public class DatasetCodec {
    private final ObjectMapper mapper;

    public DatasetCodec() { this(Json.mapper()); }

    public DatasetCodec(ObjectMapper mapper) { this.mapper = mapper; }

    public byte[] encode(Object value) throws IOException {
        if (value instanceof byte[] raw) return raw;
        return mapper.writeValueAsBytes(value);
    }

    public <T> T decode(byte[] data, Class<T> type) throws IOException {
        if (type == byte[].class) return type.cast(data);
        return mapper.readValue(data, type);
    }

    public static String version(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
