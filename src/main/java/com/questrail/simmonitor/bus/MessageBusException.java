package com.questrail.simmonitor.bus;

/**
 * The message bus could not be reached, or spoke an unexpected protocol.
 */
public final class MessageBusException extends RuntimeException
{
    public MessageBusException(String message) {
        super(message);
    }

    public MessageBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
