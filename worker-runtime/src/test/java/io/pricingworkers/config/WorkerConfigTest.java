package io.pricingworkers.config;

import io.pricingworkers.core.TaskName;
import io.pricingworkers.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerConfigTest {
    @Test
    void defaults_apply_when_nothing_is_set() {
        WorkerConfig c = WorkerConfig.from(new Properties(), Map.of());
        assertEquals("SPY", c.ticker());
        assertEquals("memory://localhost:6379/13", c.brokerAddress());
        assertEquals("memory://localhost:6379/14", c.backendAddress());
        assertEquals(Duration.ofSeconds(300), c.cacheTtl());
        assertEquals(4, c.workers());
        assertEquals(3, c.maxRetries());
        assertEquals(30, c.minPreparedRows());
        assertEquals(EnumSet.allOf(TaskName.class), c.capabilities());
        assertTrue(c.enabledUpload());
        assertTrue(c.enabledPublish());
    }

    @Test
    void system_properties_override_environment() {
        Properties props = new Properties();
        props.setProperty("pricing.workers", "2");
        Map<String, String> env = Map.of(
                "PRICING_WORKERS", "8",
                "PRICING_ENABLED_PUBLISH", "false",
                "PRICING_CAPABILITIES", "task_run_algo,prepare_pricing_dataset");
        WorkerConfig c = WorkerConfig.from(props, env);
        assertEquals(2, c.workers());
        assertFalse(c.enabledPublish());
        assertEquals(EnumSet.of(TaskName.TASK_RUN_ALGO, TaskName.PREPARE_PRICING_DATASET), c.capabilities());
    }

    @Test
    void shared_broker_and_backend_namespace_is_a_startup_error() {
        Map<String, String> env = Map.of("PRICING_BACKEND_ADDRESS", "memory://localhost:6379/13");
        assertThrows(ConfigurationException.class, () -> WorkerConfig.from(new Properties(), env));
    }

    @Test
    void bad_values_are_configuration_errors() {
        assertThrows(ConfigurationException.class, () -> WorkerConfig.from(new Properties(), Map.of("PRICING_WORKERS", "many")));
        assertThrows(ConfigurationException.class, () -> WorkerConfig.from(new Properties(), Map.of("PRICING_WORKERS", "0")));
        assertThrows(ConfigurationException.class, () -> WorkerConfig.from(new Properties(), Map.of("PRICING_ENABLED_UPLOAD", "maybe")));
        assertThrows(ConfigurationException.class, () -> WorkerConfig.from(new Properties(), Map.of("PRICING_CAPABILITIES", "nope")));
    }

    @Test
    void secrets_are_masked() {
        Map<String, String> env = Map.of(
                "PRICING_OBJECTSTORE_ACCESS_KEY", "AKIAEXAMPLE",
                "PRICING_OBJECTSTORE_SECRET_KEY", "supersecretvalue");
        String s = WorkerConfig.from(new Properties(), env).toString();
        assertFalse(s.contains("supersecretvalue"), s);
        assertFalse(s.contains("AKIAEXAMPLE"), s);
        assertTrue(s.contains("AK****LE"), s);
    }
}
