package com.questrail.simmonitor.internal.predicate;

import java.util.List;

/**
 * A field path did not resolve against a delivered message.
 */
public final class FieldResolutionException extends PredicateEvaluationException
{
    private final List<String> path;
    private final String missingKey;

    public FieldResolutionException(List<String> path, String missingKey) {
        super("Field '" + String.join(".", path) + "' does not resolve: no key '" + missingKey + "'");
        this.path = List.copyOf(path);
        this.missingKey = missingKey;
    }

    public List<String> path() {
        return path;
    }

    public String missingKey() {
        return missingKey;
    }
}
