package com.questrail.simmonitor.ast;

/**
 * Parses requirement text into a {@link RequirementAst}.
 *
 * <p>Implementations live outside this project. They must throw
 * {@link RequirementParseException} for malformed text rather than return a
 * partial AST.</p>
 */
@FunctionalInterface
public interface RequirementParser
{
    RequirementAst parse(String text);
}
