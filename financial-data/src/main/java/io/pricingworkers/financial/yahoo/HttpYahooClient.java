package io.pricingworkers.financial.yahoo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpYahooClient implements YahooClient {
    private static final Logger log = LoggerFactory.getLogger(HttpYahooClient.class);
    private static final int ATTEMPTS = 3;

    private final HttpClient http;
    private final String baseUrl;

    public HttpYahooClient() { this("https://query1.finance.yahoo.com"); }

    public HttpYahooClient(String baseUrl) {
        this.baseUrl = baseUrl;
        this.http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    }

    @Override
    public String fetch(String ticker, long period1, long period2, String interval) throws IOException, InterruptedException {
        String url = String.format("%s/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d",
                baseUrl,
                URLEncoder.encode(ticker, StandardCharsets.UTF_8),
                URLEncoder.encode(interval, StandardCharsets.UTF_8),
                period1, period2);
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("User-Agent", "Mozilla/5.0")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        HttpResponse<String> resp = null;
        for (int attempt = 1; attempt <= ATTEMPTS; attempt++) {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 200) return resp.body();
            // 4xx other than 429 is final
            if (resp.statusCode() >= 400 && resp.statusCode() < 500 && resp.statusCode() != 429) break;
            log.debug("yahoo status={} ticker={} attempt={}", resp.statusCode(), ticker, attempt);
            if (attempt < ATTEMPTS) Thread.sleep(250L * attempt);
        }
        throw new IOException("yahoo fetch failed for " + ticker + ": status " + resp.statusCode());
    }
}
