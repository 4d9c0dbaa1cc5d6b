package com.questrail.simmonitor.observability;

import java.time.Instant;

/**
 * A requirement node changed state.
 *
 * @param requirement short description of the node, e.g. {@code existence(event(/bump))}
 */
public record RequirementTransitionEvent(
    Instant timestamp,
    String requirement,
    RequirementTransition transition
) {
}
