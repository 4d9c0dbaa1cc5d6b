package com.questrail.simmonitor.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every ordering decision made by the monitor.
 *
 * <h2>Binding invariant</h2>
 * Satisfaction timestamps, trigger boundaries and requirement windows are all
 * expressed in ticks of this clock. Wall-clock time is only ever used to label
 * report lines and observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();
}
