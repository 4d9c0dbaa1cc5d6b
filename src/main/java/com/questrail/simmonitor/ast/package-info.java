/**
 * Requirement AST: the contract with the external requirement parser
 * =============================================================================
 *
 * <p>The monitor never reads requirement text itself. An external
 * {@link com.questrail.simmonitor.ast.RequirementParser} turns each requirement
 * string into a {@link com.questrail.simmonitor.ast.RequirementAst}, which the
 * tree builder compiles into a live requirement subtree.</p>
 *
 * <pre>
 *   "globally: /bump {force &gt; 5} within 10 s"
 *        → RequirementParser            (external)
 *            → RequirementAst           (pattern, window, events)
 *                → RequirementTreeBuilder
 *                    → requirement node subtree
 * </pre>
 *
 * <p>Child order is significant. For {@link com.questrail.simmonitor.ast.PatternType#RESPONSE}
 * and {@link com.questrail.simmonitor.ast.PatternType#PREVENTION} the events
 * are {@code [P, Q]}; for {@link com.questrail.simmonitor.ast.PatternType#PRECEDENCE}
 * they are {@code [Q, P]} (Q requires a prior P).</p>
 */
package com.questrail.simmonitor.ast;
