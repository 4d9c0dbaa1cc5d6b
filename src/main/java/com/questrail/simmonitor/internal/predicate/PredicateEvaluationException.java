package com.questrail.simmonitor.internal.predicate;

/**
 * A compiled predicate could not be evaluated against a delivered message.
 *
 * <p>Typical causes:</p>
 * <ul>
 *   <li>a field path that does not exist in the message ({@link FieldResolutionException})</li>
 *   <li>an ordering comparison between incompatible types</li>
 * </ul>
 */
public class PredicateEvaluationException extends RuntimeException
{
    public PredicateEvaluationException(String message) {
        super(message);
    }
}
