package com.questrail.simmonitor.internal.command;

/**
 * CommandHandler
 * =============================================================================
 * A participant in the requirement tree's command protocol.
 *
 * <h2>Delivery</h2>
 * There is no queue. Sending a command is a direct, synchronous call into the
 * target's handler on the sender's thread: a bus-delivery thread, a timer
 * thread, or the coordinator's caller. Handlers therefore serialize access to
 * their own state, and never call another node while holding their own lock.
 *
 * @param <N> the node type that sends upstream commands to this handler
 */
public interface CommandHandler<N>
{
    /**
     * Invoked by a child.
     *
     * @param source  the child that sent the command
     * @param command STATUS_CHANGE or STOP
     */
    void handleUpstream(N source, Command command);

    /**
     * Invoked by the father.
     *
     * @param command CONNECT, DISCONNECT or TRIGGER
     */
    void handleDownstream(Command command);
}
