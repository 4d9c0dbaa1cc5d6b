package com.questrail.simmonitor.internal.command;

import com.questrail.simmonitor.bus.MessageBus;

import java.util.Objects;

/**
 * Command
 * =============================================================================
 * Immutable envelope passed between requirement nodes.
 *
 * <p>Only {@link CommandKind#CONNECT} carries a bus and only
 * {@link CommandKind#TRIGGER} carries a timestamp. Instances are created
 * through {@link Commands}.</p>
 *
 * @param kind      command kind
 * @param bus       bus handle for CONNECT, otherwise {@code null}
 * @param timestamp monotonic nanoseconds for TRIGGER, otherwise {@code 0}
 */
public record Command(CommandKind kind, MessageBus bus, long timestamp)
{
    /**
     * Trigger boundary older than any observation. Every satisfaction recorded
     * since CONNECT lies strictly after it.
     */
    public static final long SINCE_START = Long.MIN_VALUE;

    public Command {
        Objects.requireNonNull(kind, "kind");
        if ((kind == CommandKind.CONNECT) != (bus != null)) {
            throw new IllegalArgumentException("Only CONNECT carries a bus handle");
        }
        if (kind != CommandKind.TRIGGER && timestamp != 0) {
            throw new IllegalArgumentException("Only TRIGGER carries a timestamp");
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case TRIGGER:
                return timestamp == SINCE_START ? "TRIGGER(since start)" : "TRIGGER(" + timestamp + ")";
            default:
                return kind.name();
        }
    }
}
