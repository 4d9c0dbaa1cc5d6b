package com.questrail.simmonitor.internal.command;

import com.questrail.simmonitor.bus.MessageBus;

import java.util.Objects;

/**
 * Factory functions for {@link Command}.
 */
public final class Commands
{
    private static final Command DISCONNECT = new Command(CommandKind.DISCONNECT, null, 0);
    private static final Command STATUS_CHANGE = new Command(CommandKind.STATUS_CHANGE, null, 0);
    private static final Command STOP = new Command(CommandKind.STOP, null, 0);

    private Commands() {
    }

    public static Command connect(MessageBus bus) {
        return new Command(CommandKind.CONNECT, Objects.requireNonNull(bus, "bus"), 0);
    }

    public static Command disconnect() {
        return DISCONNECT;
    }

    public static Command statusChange() {
        return STATUS_CHANGE;
    }

    public static Command stop() {
        return STOP;
    }

    /**
     * @param timestamp boundary in monotonic nanoseconds; observations at or
     *                  before it do not count
     */
    public static Command trigger(long timestamp) {
        return new Command(CommandKind.TRIGGER, null, timestamp);
    }

    public static Command triggerSinceStart() {
        return trigger(Command.SINCE_START);
    }
}
