package com.questrail.simmonitor.config;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MonitorConfigTest
 * -----------------------------------------------------------------------------
 */
class MonitorConfigTest {

    @Test
    void builderAppliesDefaults() {
        MonitorConfig config = MonitorConfig.builder().withHostname("localhost").build();

        assertEquals(List.of(), config.requirements());
        assertEquals(9090, config.port());
        assertEquals(Duration.ofSeconds(300), config.timeout());
        assertEquals(Duration.ZERO, config.ignore());
        assertEquals(Duration.ofSeconds(10), config.connectTimeout());
        assertEquals(URI.create("ws://localhost:9090"), config.busUri());
    }

    @Test
    void requirementsAreCopied() {
        List<String> requirements = new ArrayList<>(List.of("first"));
        MonitorConfig config = MonitorConfig.builder()
                .withHostname("sim")
                .withRequirements(requirements)
                .build();

        requirements.add("second");

        assertEquals(List.of("first"), config.requirements());
        assertThrows(UnsupportedOperationException.class, () -> config.requirements().add("third"));
    }

    @Test
    void explicitValuesAreKept() {
        MonitorConfig config = MonitorConfig.builder()
                .withHostname("10.0.0.7")
                .withPort(9091)
                .withTimeout(Duration.ofSeconds(60))
                .withIgnore(Duration.ofSeconds(3))
                .withConnectTimeout(Duration.ofSeconds(2))
                .build();

        assertEquals(Duration.ofSeconds(3), config.ignore());
        assertEquals(URI.create("ws://10.0.0.7:9091"), config.busUri());
    }

    @Test
    void hostnameIsRequired() {
        assertThrows(NullPointerException.class, () -> MonitorConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> MonitorConfig.builder().withHostname(" ").build());
    }

    @Test
    void portMustBeValid() {
        assertThrows(IllegalArgumentException.class, () -> MonitorConfig.builder().withHostname("h").withPort(0).build());
        assertThrows(IllegalArgumentException.class, () -> MonitorConfig.builder().withHostname("h").withPort(70000).build());
    }

    @Test
    void durationsMustNotBeNegative() {
        assertThrows(IllegalArgumentException.class, () ->
                MonitorConfig.builder().withHostname("h").withTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class, () ->
                MonitorConfig.builder().withHostname("h").withIgnore(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class, () ->
                MonitorConfig.builder().withHostname("h").withConnectTimeout(Duration.ZERO).build());
    }

    @Test
    void zeroTimeoutIsAccepted() {
        MonitorConfig config = MonitorConfig.builder().withHostname("h").withTimeout(Duration.ZERO).build();

        assertEquals(Duration.ZERO, config.timeout());
    }
}
