package com.questrail.simmonitor.observability;

import com.questrail.simmonitor.api.LeafReport;
import com.questrail.simmonitor.api.MonitorVerdict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MonitorObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jMonitorObservabilitySink implements MonitorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMonitorObservabilitySink.class);

    @Override
    public void onRequirementTransition(RequirementTransitionEvent event) {
        switch (event.transition()) {
            case SATISFIED:
            case VIOLATED:
            case EXPIRED:
                log.info("Requirement {}: {}", event.requirement(), event.transition());
                break;
            default:
                log.debug("Requirement {}: {}", event.requirement(), event.transition());
        }
    }

    @Override
    public void onRunFinished(MonitorFinishedEvent event) {
        if (event.verdict() == MonitorVerdict.SATISFIED) {
            log.info("Simulation run finished: {}", event.verdict());
        } else {
            log.warn("Simulation run finished: {}", event.verdict());
        }

        if (event.report().requirements().isEmpty()) {
            log.info("No simulation requirements were provided.");
        }
        for (LeafReport leaf : event.report().leaves()) {
            log.info("{}", leaf.render());
        }
    }

    @Override
    public void onTransportEvent(MonitorTransportEvent event) {
        if (event.kind() == MonitorTransportEvent.Kind.DOWN) {
            log.warn("Message bus {} down: {}", event.endpoint(), event.detail());
        } else if (event.kind() == MonitorTransportEvent.Kind.UP) {
            log.info("Connected to message bus at '{}'", event.endpoint());
        } else {
            log.debug("Message bus {}: {} {}", event.endpoint(), event.kind(), event.detail());
        }
    }

    @Override
    public void onError(MonitorErrorEvent event) {
        log.error("Monitor error: {}", event.message(), event.cause());
    }
}
