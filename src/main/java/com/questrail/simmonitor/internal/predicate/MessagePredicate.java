package com.questrail.simmonitor.internal.predicate;

import java.util.Map;

/**
 * Compiled test over a structured bus message.
 *
 * <p>Implementations are pure and thread-safe. Evaluation may throw
 * {@link PredicateEvaluationException} (including
 * {@link FieldResolutionException}); such failures indicate a mismatch between
 * the requirement and the message schema and must not be treated as
 * {@code false}.</p>
 */
@FunctionalInterface
public interface MessagePredicate
{
    MessagePredicate ALWAYS = message -> true;

    boolean test(Map<String, Object> message);
}
