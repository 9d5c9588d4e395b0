package io.pricingworkers.core;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Scalar and blob kinds a payload field may hold.
 */
public enum FieldType {
    STRING, INTEGER, DECIMAL, BOOLEAN, DATE, TICKER, TICKER_LIST, CSV;

    private static final Pattern TICKER_PATTERN = Pattern.compile("[A-Za-z0-9.^=\\-]{1,16}");

    boolean accepts(Object value) {
        if (value == null) return false;
        switch (this) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                if (value instanceof Integer || value instanceof Long) return true;
                return value instanceof String s && parses(() -> Long.parseLong(s.trim()));
            case DECIMAL:
                if (value instanceof Number) return true;
                return value instanceof String s && parses(() -> Double.parseDouble(s.trim()));
            case BOOLEAN:
                if (value instanceof Boolean) return true;
                return value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")
                        || s.equals("1") || s.equals("0"));
            case DATE:
                return value instanceof String s && parses(() -> LocalDate.parse(s.trim()));
            case TICKER:
                return value instanceof String s && TICKER_PATTERN.matcher(s.trim()).matches();
            case TICKER_LIST:
                if (!(value instanceof String s) || s.isBlank()) return false;
                for (String part : s.split(",")) {
                    if (!TICKER_PATTERN.matcher(part.trim()).matches()) return false;
                }
                return true;
            case CSV:
                return value instanceof String s && !s.isBlank() && s.indexOf('\n') >= 0;
            default:
                return false;
        }
    }

    private static boolean parses(Runnable r) {
        try {
            r.run();
            return true;
        } catch (NumberFormatException | DateTimeParseException e) {
            return false;
        }
    }
}
