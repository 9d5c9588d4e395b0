package io.pricingworkers.broker;

import io.pricingworkers.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ChannelAddressTest {
    @Test
    void parses_scheme_host_port_and_namespace() {
        ChannelAddress a = ChannelAddress.parse("memory://localhost:6379/13");
        assertEquals("memory", a.scheme());
        assertEquals("localhost", a.host());
        assertEquals(6379, a.port());
        assertEquals(13, a.namespace());
        assertEquals("memory://localhost:6379/13", a.toString());
    }

    @Test
    void rejects_malformed_addresses() {
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse("localhost:6379/13"));
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse("memory://localhost/13"));
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse("memory://localhost:6379/x"));
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse("memory://localhost:99999/1"));
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse("redis://localhost:6379/1"));
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse(null));
    }

    @Test
    void h2_addresses_map_to_jdbc_urls() {
        assertTrue(ChannelAddress.parse("h2://mem:0/13").jdbcUrl().startsWith("jdbc:h2:mem:"));
        assertEquals("jdbc:h2:tcp://db:9092/pricing_workers", ChannelAddress.parse("h2://db:9092/13").jdbcUrl());
        assertThrows(ConfigurationException.class, () -> ChannelAddress.parse("memory://localhost:1/1").jdbcUrl());
    }

    @Test
    void broker_and_backend_must_not_share_a_namespace() {
        ChannelAddress broker = ChannelAddress.parse("memory://localhost:6379/13");
        ChannelAddress.requireDistinct(broker, ChannelAddress.parse("memory://localhost:6379/14"));
        ChannelAddress.requireDistinct(broker, ChannelAddress.parse("memory://otherhost:6379/13"));
        assertThrows(ConfigurationException.class,
                () -> ChannelAddress.requireDistinct(broker, ChannelAddress.parse("memory://localhost:6379/13")));
    }
}
