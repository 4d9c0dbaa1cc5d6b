package com.questrail.simmonitor.observability;

/**
 * No-op implementation of MonitorObservabilitySink.
 */
public final class NullObservabilitySink implements MonitorObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRequirementTransition(RequirementTransitionEvent event) {}

    @Override
    public void onRunFinished(MonitorFinishedEvent event) {}

    @Override
    public void onTransportEvent(MonitorTransportEvent event) {}

    @Override
    public void onError(MonitorErrorEvent event) {}
}
