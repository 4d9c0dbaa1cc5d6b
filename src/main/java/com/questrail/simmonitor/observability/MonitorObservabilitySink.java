package com.questrail.simmonitor.observability;

/**
 * Receives monitor observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from bus-delivery, timer and caller threads, never while
 * a requirement node holds its lock. Implementations must be thread-safe.</p>
 */
public interface MonitorObservabilitySink {
    /**
     * Called when a requirement node changes state.
     */
    void onRequirementTransition(RequirementTransitionEvent event);

    /**
     * Called once, when the coordinator finishes the run.
     */
    void onRunFinished(MonitorFinishedEvent event);

    /**
     * Called for bus connection and subscription activity.
     */
    void onTransportEvent(MonitorTransportEvent event);

    /**
     * Called when an error is routed to the coordinator.
     */
    void onError(MonitorErrorEvent event);
}
