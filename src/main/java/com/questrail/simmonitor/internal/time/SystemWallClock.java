package com.questrail.simmonitor.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by {@link Instant#now()}. Labels only; never ordering.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
