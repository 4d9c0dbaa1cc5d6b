package com.questrail.simmonitor.api;

/**
 * Why a monitored run ended.
 */
public enum MonitorVerdict
{
    /** Still running. */
    RUNNING,

    /** Every requirement was satisfied after the ignore window. */
    SATISFIED,

    /** A requirement reported an irrecoverable violation. */
    VIOLATED,

    /** The hard deadline elapsed before the requirements converged. */
    TIMED_OUT,

    /** The run was cancelled by its operator. */
    ABORTED,

    /** A message could not be evaluated, or the bus connection was lost. */
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
