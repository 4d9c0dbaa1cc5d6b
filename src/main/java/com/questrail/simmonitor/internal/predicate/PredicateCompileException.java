package com.questrail.simmonitor.internal.predicate;

/**
 * A predicate expression uses an unsupported operator, operand shape or literal.
 */
public final class PredicateCompileException extends RuntimeException
{
    public PredicateCompileException(String message) {
        super(message);
    }
}
