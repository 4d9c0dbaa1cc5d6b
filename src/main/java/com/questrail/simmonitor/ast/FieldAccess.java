package com.questrail.simmonitor.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Path of keys into a structured message, e.g. {@code pose.position.x}.
 */
public record FieldAccess(List<String> path) implements PredicateExpression {

    public FieldAccess {
        path = List.copyOf(Objects.requireNonNull(path, "path"));
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
        for (String key : path) {
            if (key.isEmpty()) {
                throw new IllegalArgumentException("path contains an empty key");
            }
        }
    }

    /**
     * Field of the current message, written as a dotted path.
     */
    public static FieldAccess of(String dottedPath) {
        return new FieldAccess(Arrays.asList(dottedPath.split("\\.", -1)));
    }

    /**
     * Field {@code field} nested under message field {@code messageField}.
     */
    public static FieldAccess of(String messageField, String field) {
        List<String> path = new ArrayList<>(Arrays.asList(messageField.split("\\.", -1)));
        path.addAll(Arrays.asList(field.split("\\.", -1)));
        return new FieldAccess(path);
    }

    public String dotted() {
        return String.join(".", path);
    }
}
