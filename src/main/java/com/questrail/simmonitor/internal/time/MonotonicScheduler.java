package com.questrail.simmonitor.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer service used by requirement nodes and the monitor coordinator.
 *
 * <p>Expiry callbacks run on a thread owned by the implementation, concurrently
 * with message-bus callbacks. Callers must not assume any ordering between a
 * timer callback and a message delivered at the same instant.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds of {@link MonotonicClock#nowNanos()}
     * @param task          expiry callback
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task after {@code delay}, measured from {@code clock}'s current tick.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(saturatedAdd(clock.nowNanos(), delay), task);
    }

    /**
     * Adds a duration to a tick, clamping at {@link Long#MAX_VALUE}.
     * Requirement windows may be configured far beyond any realistic run.
     */
    static long saturatedAdd(long nanos, Duration delay)
    {
        long delta;
        try {
            delta = delay.toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
        long sum = nanos + delta;
        return ((nanos ^ sum) & (delta ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }
}
