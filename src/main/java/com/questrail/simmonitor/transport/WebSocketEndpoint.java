package com.questrail.simmonitor.transport;

/**
 * WebSocketEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a client WebSocket carrying text frames.
 *
 * <p>The endpoint moves whole text frames. Decoding the JSON they carry is the
 * bus adapter's job.</p>
 */
public interface WebSocketEndpoint
{
    /**
     * Connect and perform the opening handshake.
     *
     * <p>Returns immediately. Success is signalled through
     * {@link WebSocketEndpointListener#onTransportUp()}, failure through
     * {@link WebSocketEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the connection and release all transport resources. Idempotent.
     */
    void stop();

    /**
     * Send one text frame.
     *
     * @throws IllegalStateException if the handshake has not completed
     */
    void send(String text);

    /**
     * Register the listener for inbound frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(WebSocketEndpointListener listener);
}
