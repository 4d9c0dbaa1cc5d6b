package com.questrail.simmonitor.observability;

import java.time.Instant;

/**
 * Bus connection and subscription activity.
 *
 * @param endpoint bus address, e.g. {@code ws://localhost:9090}
 * @param detail   topic for subscription events, cause text for DOWN, otherwise empty
 */
public record MonitorTransportEvent(
    Instant timestamp,
    String endpoint,
    Kind kind,
    String detail
) {
    public enum Kind {
        UP,
        DOWN,
        SUBSCRIBED,
        UNSUBSCRIBED
    }
}
