package com.questrail.simmonitor.observability;

/**
 * Observable transitions of a requirement node.
 */
public enum RequirementTransition
{
    /** A leaf or pattern opened its observation boundary. */
    TRIGGERED,

    /** The node reported satisfaction to its father. */
    SATISFIED,

    /** The node reported a violation to its father. */
    VIOLATED,

    /** The node's own window elapsed. */
    EXPIRED,

    /** An absence window elapsed with no violation; the verdict is final. */
    WINDOW_CLOSED
}
