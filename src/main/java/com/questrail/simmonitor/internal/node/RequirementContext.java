package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.time.MonotonicClock;
import com.questrail.simmonitor.internal.time.MonotonicScheduler;
import com.questrail.simmonitor.internal.time.SystemMonotonicClock;
import com.questrail.simmonitor.internal.time.SystemWallClock;
import com.questrail.simmonitor.internal.time.WallClock;
import com.questrail.simmonitor.observability.MonitorObservabilitySink;
import com.questrail.simmonitor.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Services shared by every node of one monitored run.
 *
 * @param clock     orders observations and arms windows
 * @param wallClock labels reports and events
 * @param scheduler fires requirement windows and coordinator timers
 * @param sink      receives node transitions
 */
public record RequirementContext(
        MonotonicClock clock,
        WallClock wallClock,
        MonotonicScheduler scheduler,
        MonitorObservabilitySink sink
) {
    public RequirementContext {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(scheduler, "scheduler");
        sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Context on system clocks.
     */
    public static RequirementContext system(MonotonicScheduler scheduler, MonitorObservabilitySink sink) {
        return new RequirementContext(SystemMonotonicClock.INSTANCE, SystemWallClock.INSTANCE, scheduler, sink);
    }
}
