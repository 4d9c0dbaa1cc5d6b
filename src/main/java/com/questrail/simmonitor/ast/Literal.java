package com.questrail.simmonitor.ast;

import java.util.Objects;

/**
 * A literal operand: a {@link Number}, a {@link Boolean}, or a string token
 * still carrying its quote markers ({@code "done"} or {@code 'done'}).
 */
public record Literal(Object value) implements PredicateExpression {

    public Literal {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof Number || value instanceof Boolean || value instanceof String)) {
            throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
        }
    }
}
