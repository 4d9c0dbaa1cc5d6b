package com.questrail.simmonitor.bus;

/**
 * MessageBus
 * =============================================================================
 * Subscription port to the simulation's message bus.
 *
 * <p>The monitor only subscribes; it never publishes. Messages on a topic are
 * delivered in receipt order. Delivery may happen on any thread, and handlers
 * of different topics may run concurrently.</p>
 */
public interface MessageBus
{
    /**
     * Start delivering messages of {@code topic} to {@code handler}.
     *
     * @param topic   topic name, e.g. {@code /odom}
     * @param type    message type, e.g. {@code nav_msgs/Odometry}
     * @param handler callback; compared by identity
     */
    void register(String topic, String type, MessageHandler handler);

    /**
     * Stop delivering to {@code handler}. Unknown registrations are ignored.
     */
    void unregister(String topic, String type, MessageHandler handler);
}
