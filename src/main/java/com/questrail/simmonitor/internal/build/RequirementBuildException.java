package com.questrail.simmonitor.internal.build;

/**
 * A requirement could not be turned into a node tree. No run may start.
 */
public final class RequirementBuildException extends RuntimeException
{
    public RequirementBuildException(String message) {
        super(message);
    }

    public RequirementBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
