package io.pricingworkers.financial.yahoo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pricingworkers.core.Json;
import io.pricingworkers.financial.pricing.PriceBar;

import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts daily bars from a v8 chart response ({@code chart.result[0].timestamp} plus
 * {@code indicators.quote[0]} arrays). Null entries become missing values.
 */
public final class YahooChartParser {
    private final ObjectMapper mapper;

    public YahooChartParser() { this(Json.mapper()); }

    public YahooChartParser(ObjectMapper mapper) { this.mapper = mapper; }

    public List<PriceBar> parse(String body) throws IOException {
        JsonNode chart = mapper.readTree(body).path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new IOException("yahoo chart error: " + error.path("description").asText(error.toString()));
        }
        JsonNode result = chart.path("result").path(0);
        if (result.isMissingNode()) return List.of();

        ZoneId zone = zone(result.path("meta").path("exchangeTimezoneName").asText(null));
        JsonNode ts = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);
        List<PriceBar> out = new ArrayList<>(ts.size());
        for (int i = 0; i < ts.size(); i++) {
            LocalDate d = Instant.ofEpochSecond(ts.get(i).asLong()).atZone(zone).toLocalDate();
            Double close = num(quote.path("close").path(i));
            Long volume = quote.path("volume").path(i).isNumber() ? quote.path("volume").path(i).asLong() : null;
            out.add(new PriceBar(d, num(quote.path("open").path(i)), num(quote.path("high").path(i)),
                    num(quote.path("low").path(i)), close, volume));
        }
        return out;
    }

    private static Double num(JsonNode n) {
        return n.isNumber() ? n.asDouble() : null;
    }

    private static ZoneId zone(String name) {
        if (name == null || name.isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}
