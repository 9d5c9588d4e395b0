package io.pricingworkers.broker;

import io.pricingworkers.error.ConfigurationException;
import io.pricingworkers.store.InMemoryKeyValueCache;
import io.pricingworkers.store.KeyValueCache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves channel addresses to broker, backend and cache instances. {@code memory} channels are shared per
 * address within one factory, so producers and workers in the same process see the same queue.
 */
public class ChannelFactory {
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final Duration pollInterval;
    private final Map<ChannelAddress, InMemoryBroker> memoryBrokers = new ConcurrentHashMap<>();
    private final Map<ChannelAddress, InMemoryResultBackend> memoryBackends = new ConcurrentHashMap<>();
    private final Map<ChannelAddress, InMemoryKeyValueCache> memoryCaches = new ConcurrentHashMap<>();

    public ChannelFactory(Clock clock, Duration visibilityTimeout, Duration pollInterval) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.visibilityTimeout = visibilityTimeout;
        this.pollInterval = pollInterval;
    }

    public Broker broker(ChannelAddress address) throws BrokerUnavailableException {
        if (ChannelAddress.MEMORY.equals(address.scheme())) {
            return memoryBrokers.computeIfAbsent(address, a -> new InMemoryBroker(visibilityTimeout, clock));
        }
        return new JdbcBroker(address.jdbcUrl(), null, null, address.namespace(), visibilityTimeout, pollInterval, clock);
    }

    public ResultBackend backend(ChannelAddress address) throws BrokerUnavailableException {
        if (ChannelAddress.MEMORY.equals(address.scheme())) {
            return memoryBackends.computeIfAbsent(address, a -> new InMemoryResultBackend());
        }
        return new JdbcResultBackend(address.jdbcUrl(), null, null, address.namespace());
    }

    public KeyValueCache cache(ChannelAddress address) {
        if (!ChannelAddress.MEMORY.equals(address.scheme())) {
            throw new ConfigurationException("cache channel supports only the memory scheme: " + address);
        }
        return memoryCaches.computeIfAbsent(address, a -> new InMemoryKeyValueCache(a.namespace(), clock));
    }
}
