package com.questrail.simmonitor.ast;

/**
 * Predicate of an event with no filtering condition.
 */
public enum VacuousTruth implements PredicateExpression {
    INSTANCE
}
