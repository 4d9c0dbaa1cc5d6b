package com.questrail.simmonitor.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Final state of one simple event of a requirement.
 *
 * @param topic          subscribed topic
 * @param satisfied      whether the requirement considers this event satisfied;
 *                       already inverted for events under an absence pattern
 * @param lastSatisfied  wall-clock time of the last qualifying message, if any
 * @param predicate      predicate text as written in the requirement
 */
public record LeafReport(
        String topic,
        boolean satisfied,
        Optional<Instant> lastSatisfied,
        String predicate
) {
    public LeafReport {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(lastSatisfied, "lastSatisfied");
        Objects.requireNonNull(predicate, "predicate");
    }

    /**
     * {@code [topic]\t- SATISFIED\t(instant): predicate}
     */
    public String render() {
        String when = lastSatisfied.map(Instant::toString).orElse("no message received");
        return "[" + topic + "]\t- " + (satisfied ? "SATISFIED" : "UNSATISFIED") + "\t(" + when + "): " + predicate;
    }
}
