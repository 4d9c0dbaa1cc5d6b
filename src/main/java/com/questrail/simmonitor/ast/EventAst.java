package com.questrail.simmonitor.ast;

/**
 * An event operand of a requirement pattern.
 *
 * <p>The tree builder understands {@link SimpleEventAst} and
 * {@link EventDisjunctionAst}; any other implementation is rejected at build
 * time.</p>
 */
public interface EventAst
{
}
