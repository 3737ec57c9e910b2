package com.metagov.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetagovConfigTest {

    @Test
    void fromMap_usesDefaultsWhenUnset() {
        MetagovConfig config = MetagovConfig.fromMap(Map.of());

        assertNull(config.getDriverEventReceiverUrl());
        assertEquals(Duration.ofSeconds(10), config.getEventTimeout());
        assertEquals(Duration.ofSeconds(30), config.getProcessStartTimeout());
        assertEquals(4, config.getSweepParallelism());
        assertEquals("https://polls.example.org", config.getPollBaseUrl());
        assertTrue(config.isLoadDiscoveredPlugins());
    }

    @Test
    void fromMap_readsValuesAndIgnoresInvalidNumbers() {
        MetagovConfig config = MetagovConfig.fromMap(Map.of(
                "METAGOV_DRIVER_EVENT_RECEIVER_URL", " http://driver:8000/events ",
                "METAGOV_EVENT_TIMEOUT_SECONDS", "3",
                "METAGOV_PROCESS_START_TIMEOUT_SECONDS", "not-a-number",
                "METAGOV_SWEEP_PARALLELISM", "-2",
                "METAGOV_LOAD_DISCOVERED_PLUGINS", "false"));

        assertEquals("http://driver:8000/events", config.getDriverEventReceiverUrl());
        assertEquals(Duration.ofSeconds(3), config.getEventTimeout());
        assertEquals(Duration.ofSeconds(30), config.getProcessStartTimeout());
        assertEquals(4, config.getSweepParallelism());
        assertFalse(config.isLoadDiscoveredPlugins());
    }

    @Test
    void builder_rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> MetagovConfig.builder().processStartTimeoutSeconds(0));
    }
}
