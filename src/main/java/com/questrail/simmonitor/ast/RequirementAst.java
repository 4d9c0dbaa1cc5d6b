package com.questrail.simmonitor.ast;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One parsed requirement.
 *
 * @param pattern temporal pattern
 * @param maxTime the pattern's own window; empty means unbounded
 * @param events  event operands, in the order documented on {@link PatternType}
 */
public record RequirementAst(
        PatternType pattern,
        Optional<Duration> maxTime,
        List<EventAst> events
) {
    public RequirementAst {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(maxTime, "maxTime");
        events = List.copyOf(Objects.requireNonNull(events, "events"));

        maxTime.ifPresent(window -> {
            if (window.isNegative()) {
                throw new IllegalArgumentException("maxTime must be non-negative");
            }
        });
    }

    public static RequirementAst of(PatternType pattern, Duration maxTime, EventAst... events) {
        return new RequirementAst(pattern, Optional.of(maxTime), List.of(events));
    }

    public static RequirementAst unbounded(PatternType pattern, EventAst... events) {
        return new RequirementAst(pattern, Optional.empty(), List.of(events));
    }
}
