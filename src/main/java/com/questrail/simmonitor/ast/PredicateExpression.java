package com.questrail.simmonitor.ast;

/**
 * Node of a message predicate expression.
 *
 * <p>Implementations: {@link BinaryExpression}, {@link FieldAccess},
 * {@link Literal}, {@link VacuousTruth}.</p>
 */
public interface PredicateExpression
{
}
