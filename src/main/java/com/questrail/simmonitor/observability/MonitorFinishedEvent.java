package com.questrail.simmonitor.observability;

import com.questrail.simmonitor.api.MonitorReport;
import com.questrail.simmonitor.api.MonitorVerdict;

import java.time.Instant;

/**
 * The coordinator finished the run.
 */
public record MonitorFinishedEvent(
    Instant timestamp,
    MonitorVerdict verdict,
    MonitorReport report
) {
}
