package com.questrail.simmonitor.ast;

import java.util.Objects;

/**
 * A relational comparison ({@code =, !=, <, <=, >, >=}) between a field and a
 * literal, or a combinator ({@code and, implies, iff}) over two predicates.
 *
 * @param operator operator symbol as produced by the parser
 */
public record BinaryExpression(
        String operator,
        PredicateExpression left,
        PredicateExpression right
) implements PredicateExpression {

    public BinaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
