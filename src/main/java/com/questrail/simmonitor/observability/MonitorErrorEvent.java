package com.questrail.simmonitor.observability;

import java.time.Instant;

/**
 * An error that ended or threatens the run.
 */
public record MonitorErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
