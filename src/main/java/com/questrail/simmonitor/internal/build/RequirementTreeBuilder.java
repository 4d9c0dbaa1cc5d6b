package com.questrail.simmonitor.internal.build;

import com.questrail.simmonitor.ast.EventAst;
import com.questrail.simmonitor.ast.EventDisjunctionAst;
import com.questrail.simmonitor.ast.RequirementAst;
import com.questrail.simmonitor.ast.RequirementParseException;
import com.questrail.simmonitor.ast.RequirementParser;
import com.questrail.simmonitor.ast.SimpleEventAst;
import com.questrail.simmonitor.internal.node.AbsenceNode;
import com.questrail.simmonitor.internal.node.DisjunctionNode;
import com.questrail.simmonitor.internal.node.ExistenceNode;
import com.questrail.simmonitor.internal.node.PrecedenceNode;
import com.questrail.simmonitor.internal.node.PreventionNode;
import com.questrail.simmonitor.internal.node.RequirementContext;
import com.questrail.simmonitor.internal.node.RequirementNode;
import com.questrail.simmonitor.internal.node.ResponseNode;
import com.questrail.simmonitor.internal.node.SimpleEventNode;
import com.questrail.simmonitor.internal.predicate.MessagePredicate;
import com.questrail.simmonitor.internal.predicate.PredicateCompileException;
import com.questrail.simmonitor.internal.predicate.PredicateCompiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * RequirementTreeBuilder
 * =============================================================================
 * Turns parsed requirements into unconnected node subtrees.
 *
 * <p>Every predicate is compiled here. Any failure aborts the build with a
 * {@link RequirementBuildException}; no partially built tree is returned.</p>
 */
public final class RequirementTreeBuilder
{
    private final RequirementContext context;
    private final PredicateCompiler compiler;

    public RequirementTreeBuilder(RequirementContext context) {
        this(context, new PredicateCompiler());
    }

    public RequirementTreeBuilder(RequirementContext context, PredicateCompiler compiler) {
        this.context = Objects.requireNonNull(context, "context");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    /**
     * Parses and builds every requirement, in order.
     *
     * @throws RequirementBuildException if any requirement fails to parse or build
     */
    public List<RequirementNode> buildAll(List<String> requirements, RequirementParser parser) {
        Objects.requireNonNull(requirements, "requirements");
        Objects.requireNonNull(parser, "parser");

        List<RequirementNode> trees = new ArrayList<>(requirements.size());
        for (int i = 0; i < requirements.size(); i++) {
            String text = requirements.get(i);
            RequirementAst ast;
            try {
                ast = parser.parse(text);
            } catch (RequirementParseException e) {
                throw new RequirementBuildException("Requirement #" + (i + 1) + " does not parse: " + text, e);
            }
            if (ast == null) {
                throw new RequirementBuildException("Requirement #" + (i + 1) + " parsed to nothing: " + text);
            }
            try {
                trees.add(build(ast));
            } catch (RequirementBuildException e) {
                throw new RequirementBuildException("Requirement #" + (i + 1) + " is invalid: " + text, e);
            }
        }
        return List.copyOf(trees);
    }

    /**
     * Builds the subtree for one requirement.
     */
    public RequirementNode build(RequirementAst requirement) {
        Objects.requireNonNull(requirement, "requirement");

        List<EventAst> events = requirement.events();
        if (events.size() != requirement.pattern().arity()) {
            throw new RequirementBuildException(requirement.pattern() + " takes "
                    + requirement.pattern().arity() + " event(s), got " + events.size());
        }

        switch (requirement.pattern()) {
            case EXISTENCE:
                return new ExistenceNode(context, requirement.maxTime(), buildEvent(events.get(0)));
            case ABSENCE:
                return new AbsenceNode(context, requirement.maxTime(), buildEvent(events.get(0)));
            case RESPONSE:
                return new ResponseNode(context, requirement.maxTime(),
                        buildEvent(events.get(0)), buildEvent(events.get(1)));
            case PRECEDENCE:
                return new PrecedenceNode(context, requirement.maxTime(),
                        buildEvent(events.get(0)), buildEvent(events.get(1)));
            case PREVENTION:
                return new PreventionNode(context, requirement.maxTime(),
                        buildEvent(events.get(0)), buildEvent(events.get(1)));
            default:
                throw new RequirementBuildException("Unsupported pattern: " + requirement.pattern());
        }
    }

    private RequirementNode buildEvent(EventAst event) {
        if (event instanceof SimpleEventAst) {
            SimpleEventAst simple = (SimpleEventAst) event;
            MessagePredicate predicate;
            try {
                predicate = compiler.compile(simple.predicate());
            } catch (PredicateCompileException e) {
                throw new RequirementBuildException(
                        "Invalid predicate on " + simple.topic() + ": " + simple.predicateText(), e);
            }
            return new SimpleEventNode(context, simple.topic(), simple.messageType(), predicate,
                    simple.predicateText());
        }
        if (event instanceof EventDisjunctionAst) {
            EventDisjunctionAst disjunction = (EventDisjunctionAst) event;
            return new DisjunctionNode(context, buildEvent(disjunction.first()), buildEvent(disjunction.second()));
        }
        throw new RequirementBuildException("Unsupported event: " + event);
    }
}
