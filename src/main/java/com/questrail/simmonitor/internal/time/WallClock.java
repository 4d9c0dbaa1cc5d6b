package com.questrail.simmonitor.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for report lines and observability timestamps.
 *
 * <p>It MUST NOT be used to order observations or to arm deadlines; use
 * {@link MonotonicClock} for that.</p>
 */
public interface WallClock
{
    Instant now();
}
