package com.questrail.simmonitor.api;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Human-readable outcome of a monitored run: the verdict plus one entry per
 * simple event, grouped by requirement in declaration order.
 */
public record MonitorReport(MonitorVerdict verdict, List<List<LeafReport>> requirements)
{
    public MonitorReport {
        Objects.requireNonNull(verdict, "verdict");
        requirements = requirements.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    public List<LeafReport> leaves() {
        return requirements.stream().flatMap(List::stream).collect(Collectors.toUnmodifiableList());
    }

    /**
     * One line per simple event, with a blank line between requirements.
     */
    public String render() {
        if (requirements.isEmpty()) {
            return "No simulation requirements were provided.";
        }
        return requirements.stream()
                .map(leaves -> leaves.stream().map(LeafReport::render).collect(Collectors.joining("\n")))
                .collect(Collectors.joining("\n\n"));
    }

    @Override
    public String toString() {
        return verdict + "\n" + render();
    }
}
