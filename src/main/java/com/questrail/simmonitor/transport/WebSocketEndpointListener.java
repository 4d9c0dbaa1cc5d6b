package com.questrail.simmonitor.transport;

/**
 * WebSocketEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link WebSocketEndpoint}.
 *
 * <p>Implementations deliver callbacks serially. Netty endpoints deliver them
 * on the channel's event loop.</p>
 */
public interface WebSocketEndpointListener
{
    /**
     * The handshake completed; frames may now be sent.
     */
    void onTransportUp();

    /**
     * The connection is gone, or could not be established.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * One complete inbound text frame.
     */
    void onText(String text);
}
