/**
 * Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete WebSocket client (Netty in
 * production, a fake in tests) and the rosbridge bus adapter.
 *
 * <p>Everything above this package sees only text frames and lifecycle
 * signals. Netty types stay in {@code transport.netty}.</p>
 *
 * <p>Implementations perform I/O only. They neither parse JSON nor retry.</p>
 */
package com.questrail.simmonitor.transport;
