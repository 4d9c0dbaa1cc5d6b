package com.questrail.simmonitor.ast;

/**
 * Requirement text could not be parsed.
 */
public final class RequirementParseException extends RuntimeException
{
    public RequirementParseException(String message) {
        super(message);
    }

    public RequirementParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
