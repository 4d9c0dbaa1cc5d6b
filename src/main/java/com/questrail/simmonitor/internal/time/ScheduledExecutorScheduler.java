package com.questrail.simmonitor.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Absolute deadlines are converted to relative delays at scheduling time
 * using the supplied {@link MonotonicClock}; callers must compute deadlines with
 * the same clock. Deadlines already in the past run immediately.</p>
 *
 * <p>The executor is not owned by this class. {@code SimulationMonitorRuntime}
 * creates it and shuts it down when the run is stopped.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long now = clock.nowNanos();
        long delayNanos = deadlineNanos - now;
        if (((deadlineNanos ^ now) & (deadlineNanos ^ delayNanos)) < 0) {
            delayNanos = deadlineNanos > now ? Long.MAX_VALUE : 0;
        }
        delayNanos = Math.max(0, delayNanos);
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // mayInterruptIfRunning=false: an expiry already in progress finishes under the node lock
        return () -> future.cancel(false);
    }
}
