package com.questrail.simmonitor.bus;

import java.util.function.Consumer;

/**
 * A {@link MessageBus} whose connection lifecycle is driven by the runtime.
 */
public interface ManagedMessageBus extends MessageBus
{
    /**
     * Connect to the bus. Blocks until subscriptions can be issued.
     *
     * @throws MessageBusException if the connection cannot be established
     */
    void open();

    /**
     * Release the connection. Idempotent.
     */
    void close();

    /**
     * Install the listener that receives handler failures and connection loss
     * while the bus is open. Must be called before {@link #open()}.
     */
    void setErrorListener(Consumer<Throwable> listener);
}
