package com.questrail.simmonitor.ast;

import java.util.Objects;

/**
 * A message published on {@code topic} with type {@code messageType} for which
 * {@code predicate} holds.
 *
 * @param topic         bus topic, e.g. {@code /bump}
 * @param messageType   bus message type, e.g. {@code std_msgs/Float64}
 * @param predicate     filter over the message; {@link VacuousTruth} accepts every message
 * @param predicateText the predicate as written by the user, reproduced in reports
 */
public record SimpleEventAst(
        String topic,
        String messageType,
        PredicateExpression predicate,
        String predicateText
) implements EventAst {

    public SimpleEventAst {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(predicateText, "predicateText");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
    }

    /**
     * An event with no filtering condition.
     */
    public static SimpleEventAst any(String topic, String messageType) {
        return new SimpleEventAst(topic, messageType, VacuousTruth.INSTANCE, "");
    }
}
