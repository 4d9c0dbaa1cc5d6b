package com.questrail.simmonitor.runtime;

import com.questrail.simmonitor.api.MonitorReport;

import java.util.Optional;

/**
 * The run ended because of an error rather than a verdict on the requirements,
 * or could not be started.
 */
public final class MonitorRunException extends RuntimeException
{
    private final transient MonitorReport report;

    public MonitorRunException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public MonitorRunException(String message, Throwable cause, MonitorReport report) {
        super(message, cause);
        this.report = report;
    }

    /**
     * State of the requirements when the run failed, if it got that far.
     */
    public Optional<MonitorReport> report() {
        return Optional.ofNullable(report);
    }
}
