package io.pricingworkers.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only typed view over an envelope payload. Values arrive as JSON scalars or strings, so every
 * accessor tolerates both.
 */
public final class TaskPayload {
    private final Map<String, Object> values;

    public TaskPayload(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() { return values; }

    public boolean has(String key) { return values.get(key) != null; }

    public String string(String key) {
        return optString(key).orElseThrow(() -> new InvalidPayloadException("missing field '" + key + "'"));
    }

    public Optional<String> optString(String key) {
        Object v = values.get(key);
        if (v == null) return Optional.empty();
        String s = String.valueOf(v);
        return s.isBlank() ? Optional.empty() : Optional.of(s);
    }

    public String ticker() { return string("ticker").trim().toUpperCase(Locale.ROOT); }

    public long longValue(String key, long dflt) {
        Object v = values.get(key);
        if (v == null) return dflt;
        if (v instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(v).trim());
    }

    public Optional<Double> optDecimal(String key) {
        Object v = values.get(key);
        if (v == null) return Optional.empty();
        if (v instanceof Number n) return Optional.of(n.doubleValue());
        return Optional.of(Double.parseDouble(String.valueOf(v).trim()));
    }

    public double decimal(String key, double dflt) { return optDecimal(key).orElse(dflt); }

    public Optional<Boolean> optBoolean(String key) {
        Object v = values.get(key);
        if (v == null) return Optional.empty();
        if (v instanceof Boolean b) return Optional.of(b);
        String s = String.valueOf(v).trim();
        return Optional.of(s.equalsIgnoreCase("true") || s.equals("1"));
    }

    public Optional<LocalDate> optDate(String key) {
        return optString(key).map(s -> LocalDate.parse(s.trim()));
    }

    public List<String> tickers(String key) {
        List<String> out = new ArrayList<>();
        for (String part : string(key).split(",")) {
            String t = part.trim().toUpperCase(Locale.ROOT);
            if (!t.isEmpty() && !out.contains(t)) out.add(t);
        }
        return out;
    }

    @Override
    public String toString() {
        Map<String, Object> shown = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            String s = String.valueOf(v);
            shown.put(k, s.length() > 48 ? "<" + s.length() + " chars>" : v);
        });
        return shown.toString();
    }
}
