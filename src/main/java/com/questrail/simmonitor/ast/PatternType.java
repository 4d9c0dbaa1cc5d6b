package com.questrail.simmonitor.ast;

/**
 * Temporal pattern of a requirement, with the number of events it takes.
 */
public enum PatternType
{
    /** Event P eventually occurs. */
    EXISTENCE(1),

    /** Event P never occurs. */
    ABSENCE(1),

    /** Every P is followed by Q within the window. Events: {@code [P, Q]}. */
    RESPONSE(2),

    /** Q only occurs after a prior P. Events: {@code [Q, P]}. */
    PRECEDENCE(2),

    /** Once P occurs, Q never occurs afterward. Events: {@code [P, Q]}. */
    PREVENTION(2);

    private final int arity;

    PatternType(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }
}
