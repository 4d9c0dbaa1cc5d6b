package com.questrail.simmonitor.internal.command;

/**
 * Kinds of command exchanged between requirement nodes.
 */
public enum CommandKind
{
    /** Downstream. Subscribe leaves to the bus carried in the payload, then arm timers. */
    CONNECT,

    /** Downstream. Cancel timers and drop bus subscriptions. */
    DISCONNECT,

    /** Upstream. A child's satisfaction changed; the parent re-evaluates. */
    STATUS_CHANGE,

    /** Upstream. A requirement is irrecoverably violated; the run must end. */
    STOP,

    /** Downstream. Open an observation boundary at the payload timestamp. */
    TRIGGER
}
