package io.pricingworkers.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operation-specific payload schema. Unknown keys are allowed and carried through untouched.
 */
public final class PayloadSchema {
    private final Map<String, FieldType> required;
    private final Map<String, FieldType> optional;

    private PayloadSchema(Map<String, FieldType> required, Map<String, FieldType> optional) {
        this.required = Collections.unmodifiableMap(required);
        this.optional = Collections.unmodifiableMap(optional);
    }

    public static Builder builder() { return new Builder(); }

    public Map<String, FieldType> required() { return required; }
    public Map<String, FieldType> optional() { return optional; }

    public void validate(TaskName task, Map<String, Object> payload) {
        if (payload == null) throw new InvalidPayloadException(task + ": payload is missing");
        for (Map.Entry<String, FieldType> e : required.entrySet()) {
            Object v = payload.get(e.getKey());
            if (v == null) throw new InvalidPayloadException(task + ": missing required field '" + e.getKey() + "'");
            check(task, e.getKey(), e.getValue(), v);
        }
        for (Map.Entry<String, FieldType> e : optional.entrySet()) {
            Object v = payload.get(e.getKey());
            if (v != null) check(task, e.getKey(), e.getValue(), v);
        }
    }

    private static void check(TaskName task, String key, FieldType type, Object v) {
        if (!type.accepts(v)) {
            throw new InvalidPayloadException(task + ": field '" + key + "' is not a valid " + type + ": " + abbreviate(v));
        }
    }

    private static String abbreviate(Object v) {
        String s = String.valueOf(v);
        return s.length() > 64 ? s.substring(0, 64) + "..." : s;
    }

    public static final class Builder {
        private final Map<String, FieldType> required = new LinkedHashMap<>();
        private final Map<String, FieldType> optional = new LinkedHashMap<>();

        public Builder required(String key, FieldType type) { required.put(key, type); return this; }
        public Builder optional(String key, FieldType type) { optional.put(key, type); return this; }
        public PayloadSchema build() { return new PayloadSchema(required, optional); }
    }
}
