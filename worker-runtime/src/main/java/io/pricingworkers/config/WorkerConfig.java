package io.pricingworkers.config;

import io.pricingworkers.broker.ChannelAddress;
import io.pricingworkers.core.InvalidPayloadException;
import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ConfigurationException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Startup configuration. Each key {@code x.y} is read from system property {@code pricing.x.y}, then env
 * {@code PRICING_X_Y}, then the default.
 */
public record WorkerConfig(
        String ticker,
        long tickerId,
        String brokerAddress,
        String backendAddress,
        String cacheAddress,
        boolean enabledUpload,
        boolean enabledPublish,
        String objectStoreEndpoint,
        String accessKey,
        String secretKey,
        String region,
        Duration cacheTtl,
        int workers,
        Set<TaskName> capabilities,
        int maxRetries,
        long retryBaseMillis,
        long retryMaxMillis,
        Duration visibilityTimeout,
        long pollMillis,
        int minPreparedRows,
        Duration aggregateWait,
        Duration algoSoftWait,
        Path deadLetterFile,
        String logLevel
) {
    public static WorkerConfig fromEnv() {
        return from(System.getProperties(), System.getenv());
    }

    public static WorkerConfig from(Properties props, Map<String, String> env) {
        Source s = new Source(props, env);
        WorkerConfig cfg = new WorkerConfig(
                s.get("ticker", "SPY").toUpperCase(Locale.ROOT),
                s.getLong("ticker.id", 1),
                s.get("broker.address", "memory://localhost:6379/13"),
                s.get("backend.address", "memory://localhost:6379/14"),
                s.get("cache.address", "memory://localhost:6379/0"),
                s.getBool("enabled.upload", true),
                s.getBool("enabled.publish", true),
                s.get("objectstore.endpoint", "file:./pricing-store"),
                s.get("objectstore.access.key", ""),
                s.get("objectstore.secret.key", ""),
                s.get("objectstore.region", "us-east-1"),
                Duration.ofSeconds(s.getLong("cache.ttl.seconds", 300)),
                (int) s.getLong("workers", 4),
                capabilities(s.get("capabilities", "*")),
                (int) s.getLong("max.retries", 3),
                s.getLong("retry.base.millis", 500),
                s.getLong("retry.max.millis", 30_000),
                Duration.ofSeconds(s.getLong("visibility.timeout.seconds", 60)),
                s.getLong("poll.millis", 250),
                (int) s.getLong("min.prepared.rows", 30),
                Duration.ofSeconds(s.getLong("aggregate.wait.seconds", 5)),
                Duration.ofSeconds(s.getLong("algo.soft.wait.seconds", 10)),
                Path.of(s.get("dead.letter.file", "./pricing-store/dead_letters.jsonl")),
                s.get("log.level", "INFO").toUpperCase(Locale.ROOT));
        cfg.validate();
        return cfg;
    }

    /** Fails fast on values the workers cannot run with. */
    public void validate() {
        if (workers < 1) throw new ConfigurationException("workers must be >= 1, got " + workers);
        if (maxRetries < 0) throw new ConfigurationException("max retries must be >= 0, got " + maxRetries);
        if (minPreparedRows < 1) throw new ConfigurationException("min prepared rows must be >= 1, got " + minPreparedRows);
        if (visibilityTimeout.isZero() || visibilityTimeout.isNegative()) throw new ConfigurationException("visibility timeout must be positive");
        ChannelAddress.requireDistinct(broker(), backend());
        cache();
    }

    public ChannelAddress broker() { return ChannelAddress.parse(brokerAddress); }
    public ChannelAddress backend() { return ChannelAddress.parse(backendAddress); }
    public ChannelAddress cache() { return ChannelAddress.parse(cacheAddress); }

    public WorkerConfig withWorkers(int n) {
        return new WorkerConfig(ticker, tickerId, brokerAddress, backendAddress, cacheAddress, enabledUpload, enabledPublish,
                objectStoreEndpoint, accessKey, secretKey, region, cacheTtl, n, capabilities, maxRetries, retryBaseMillis,
                retryMaxMillis, visibilityTimeout, pollMillis, minPreparedRows, aggregateWait, algoSoftWait, deadLetterFile, logLevel);
    }

    public WorkerConfig withCapabilities(Set<TaskName> caps) {
        return new WorkerConfig(ticker, tickerId, brokerAddress, backendAddress, cacheAddress, enabledUpload, enabledPublish,
                objectStoreEndpoint, accessKey, secretKey, region, cacheTtl, workers, Set.copyOf(caps), maxRetries, retryBaseMillis,
                retryMaxMillis, visibilityTimeout, pollMillis, minPreparedRows, aggregateWait, algoSoftWait, deadLetterFile, logLevel);
    }

    private static Set<TaskName> capabilities(String csv) {
        try {
            return TaskName.parseSet(csv);
        } catch (InvalidPayloadException e) {
            throw new ConfigurationException("invalid capabilities '" + csv + "': " + e.getMessage(), e);
        }
    }

    static String mask(String secret) {
        if (secret == null || secret.isEmpty()) return "";
        if (secret.length() <= 4) return "****";
        return secret.substring(0, 2) + "****" + secret.substring(secret.length() - 2);
    }

    @Override
    public String toString() {
        return "WorkerConfig{ticker=" + ticker + ", tickerId=" + tickerId
                + ", broker=" + brokerAddress + ", backend=" + backendAddress + ", cache=" + cacheAddress
                + ", enabledUpload=" + enabledUpload + ", enabledPublish=" + enabledPublish
                + ", objectStore=" + objectStoreEndpoint + ", accessKey=" + mask(accessKey) + ", secretKey=" + (secretKey.isEmpty() ? "" : "****")
                + ", region=" + region + ", cacheTtl=" + cacheTtl + ", workers=" + workers + ", capabilities=" + capabilities
                + ", maxRetries=" + maxRetries + ", retry=" + retryBaseMillis + ".." + retryMaxMillis + "ms"
                + ", visibilityTimeout=" + visibilityTimeout + ", pollMillis=" + pollMillis
                + ", minPreparedRows=" + minPreparedRows + ", aggregateWait=" + aggregateWait + ", algoSoftWait=" + algoSoftWait
                + ", deadLetterFile=" + deadLetterFile + ", logLevel=" + logLevel + "}";
    }

    private static final class Source {
        private final Properties props;
        private final Map<String, String> env;

        Source(Properties props, Map<String, String> env) {
            this.props = props == null ? new Properties() : props;
            this.env = env == null ? Map.of() : env;
        }

        String get(String key, String dflt) {
            String v = props.getProperty("pricing." + key);
            if (v == null) v = env.get("PRICING_" + key.toUpperCase(Locale.ROOT).replace('.', '_'));
            return v == null ? dflt : v.trim();
        }

        long getLong(String key, long dflt) {
            String v = get(key, null);
            if (v == null || v.isEmpty()) return dflt;
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("pricing." + key + " is not a number: " + v, e);
            }
        }

        boolean getBool(String key, boolean dflt) {
            String v = get(key, null);
            if (v == null || v.isEmpty()) return dflt;
            if (v.equalsIgnoreCase("true") || v.equals("1") || v.equalsIgnoreCase("yes")) return true;
            if (v.equalsIgnoreCase("false") || v.equals("0") || v.equalsIgnoreCase("no")) return false;
            throw new ConfigurationException("pricing." + key + " is not a boolean: " + v);
        }
    }
}
