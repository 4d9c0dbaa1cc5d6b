package com.questrail.simmonitor.bus;

import java.util.Map;

/**
 * Receives every message published on a subscribed topic until unregistered.
 *
 * <p>Handlers are compared by identity: the instance passed to
 * {@link MessageBus#unregister} must be the one passed to
 * {@link MessageBus#register}.</p>
 */
@FunctionalInterface
public interface MessageHandler
{
    /**
     * @param message decoded message body; nested messages are nested maps
     */
    void onMessage(Map<String, Object> message);
}
