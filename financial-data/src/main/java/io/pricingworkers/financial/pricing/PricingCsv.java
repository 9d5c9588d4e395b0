package io.pricingworkers.financial.pricing;

import io.pricingworkers.error.ErrorKind;
import io.pricingworkers.error.StageException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Reads and writes the pricing CSV blob carried in task payloads.
 *
 * <p>Headers are matched case-insensitively: {@code date|timestamp|datetime}, {@code open}, {@code high},
 * {@code low}, {@code close} (or {@code adj close} when there is no close column) and {@code volume}.
 */
public final class PricingCsv {
    public static final String HEADER = "date,open,high,low,close,volume";

    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<Function<String, LocalDate>> DATE_FORMS = List.<Function<String, LocalDate>>of(
            LocalDate::parse,
            v -> LocalDateTime.parse(v, SPACED).toLocalDate(),
            v -> LocalDateTime.parse(v).toLocalDate(),
            v -> OffsetDateTime.parse(v).withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());

    private PricingCsv() {}

    public record Parsed(List<PriceBar> bars, int skipped) {}

    public static Parsed parse(String csv) {
        if (csv == null || csv.isBlank()) throw invalid("empty CSV");
        String[] lines = csv.replace("\r", "").split("\n");
        int li = 0;
        while (li < lines.length && lines[li].isBlank()) li++;
        if (li == lines.length) throw invalid("empty CSV");
        Columns cols = Columns.of(lines[li]);

        List<PriceBar> bars = new ArrayList<>();
        int skipped = 0;
        for (int i = li + 1; i < lines.length; i++) {
            if (lines[i].isBlank()) continue;
            String[] f = lines[i].split(",", -1);
            LocalDate date = parseDate(field(f, cols.date));
            if (date == null) {
                skipped++;
                continue;
            }
            bars.add(new PriceBar(date,
                    parseNumber(field(f, cols.open)),
                    parseNumber(field(f, cols.high)),
                    parseNumber(field(f, cols.low)),
                    parseNumber(field(f, cols.close)),
                    toLong(parseNumber(field(f, cols.volume)))));
        }
        return new Parsed(bars, skipped);
    }

    /** Raw bars, missing values left empty. */
    public static String formatBars(List<PriceBar> bars) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (PriceBar b : bars) {
            sb.append(b.date()).append(',')
              .append(num(b.open())).append(',')
              .append(num(b.high())).append(',')
              .append(num(b.low())).append(',')
              .append(num(b.close())).append(',')
              .append(b.volume() == null ? "" : b.volume().toString()).append('\n');
        }
        return sb.toString();
    }

    public static String formatRows(List<PricingRow> rows) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        for (PricingRow r : rows) {
            sb.append(r.date()).append(',')
              .append(r.open()).append(',')
              .append(r.high()).append(',')
              .append(r.low()).append(',')
              .append(r.close()).append(',')
              .append(r.volume()).append('\n');
        }
        return sb.toString();
    }

    static LocalDate parseDate(String s) {
        if (s == null) return null;
        String v = s.trim();
        if (v.isEmpty()) return null;
        if (v.chars().allMatch(Character::isDigit) && v.length() >= 9) {
            long n = Long.parseLong(v);
            // millisecond timestamps
            if (v.length() >= 12) n = n / 1000;
            return Instant.ofEpochSecond(n).atZone(ZoneOffset.UTC).toLocalDate();
        }
        for (Function<String, LocalDate> form : DATE_FORMS) {
            try {
                return form.apply(v);
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return null;
    }

    static Double parseNumber(String s) {
        if (s == null) return null;
        String v = s.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null") || v.equalsIgnoreCase("nan")) return null;
        try {
            double d = Double.parseDouble(v);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long toLong(Double d) { return d == null ? null : (long) d.doubleValue(); }

    private static String field(String[] f, int idx) { return idx < 0 || idx >= f.length ? null : f[idx]; }

    private static String num(Double d) { return d == null ? "" : d.toString(); }

    private static StageException invalid(String msg) {
        return new StageException(ErrorKind.VALIDATION, "InvalidCsv", msg);
    }

    private record Columns(int date, int open, int high, int low, int close, int volume) {
        static Columns of(String header) {
            String[] h = header.split(",", -1);
            int date = -1, open = -1, high = -1, low = -1, close = -1, adjClose = -1, volume = -1;
            for (int i = 0; i < h.length; i++) {
                String name = h[i].trim().replace("\"", "").toLowerCase(Locale.ROOT);
                switch (name) {
                    case "date", "timestamp", "datetime" -> { if (date < 0) date = i; }
                    case "open" -> open = i;
                    case "high" -> high = i;
                    case "low" -> low = i;
                    case "close" -> close = i;
                    case "adj close", "adj_close", "adjclose" -> adjClose = i;
                    case "volume" -> volume = i;
                    default -> { }
                }
            }
            if (close < 0) close = adjClose;
            if (date < 0) throw invalid("CSV header has no date column: " + header);
            if (close < 0) throw invalid("CSV header has no close column: " + header);
            return new Columns(date, open, high, low, close, volume);
        }
    }
}
