package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.api.LeafReport;
import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.CommandHandler;
import com.questrail.simmonitor.observability.RequirementTransition;
import com.questrail.simmonitor.observability.RequirementTransitionEvent;

import java.util.List;
import java.util.Objects;

/**
 * RequirementNode
 * =============================================================================
 * Base of every node in a requirement tree below the {@link MonitorCoordinator}.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>{@code children} are owned by the node and fixed at construction.</li>
 *   <li>{@code father} is a non-owning back-reference used only to route
 *       upstream commands. It is set exactly once, when the node is adopted.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * Each node guards its mutable state with {@link #lock}. Commands to other
 * nodes are always sent after the lock is released. A parent may read a
 * child's state while holding its own lock; a child never acquires its
 * parent's lock. Locks are therefore only ever nested top-down.
 */
public abstract class RequirementNode implements CommandHandler<RequirementNode>
{
    /**
     * Timestamp of a node that has never been satisfied.
     */
    public static final long NEVER = Long.MIN_VALUE;

    protected final Object lock = new Object();
    protected final RequirementContext context;

    private final List<RequirementNode> children;
    private volatile CommandHandler<RequirementNode> father;

    protected RequirementNode(RequirementContext context, List<RequirementNode> children) {
        this.context = Objects.requireNonNull(context, "context");
        this.children = List.copyOf(children);
        for (RequirementNode child : this.children) {
            child.adoptBy(this);
        }
    }

    /**
     * Pattern-specific success flag. For an absence it means "no violation yet".
     */
    public abstract boolean isSatisfied();

    /**
     * Monotonic timestamp of the observation that satisfied this node, or
     * {@link #NEVER}. Only events (leaves and disjunctions) carry one.
     */
    public long lastSatisfiedAt() {
        return NEVER;
    }

    /**
     * Short description used in observability events.
     */
    public abstract String describe();

    public final List<RequirementNode> children() {
        return children;
    }

    /**
     * Sets the father. A node belongs to exactly one tree position.
     *
     * @throws IllegalStateException if the node was already adopted
     */
    public final void adoptBy(CommandHandler<RequirementNode> father) {
        Objects.requireNonNull(father, "father");
        synchronized (lock) {
            if (this.father != null) {
                throw new IllegalStateException(describe() + " already has a father");
            }
            this.father = father;
        }
    }

    /**
     * Appends one {@link LeafReport} per simple event of this subtree.
     *
     * @param underAbsence whether the events are forbidden ones, which inverts their label
     */
    public void collectLeaves(List<LeafReport> out, boolean underAbsence) {
        for (RequirementNode child : children) {
            child.collectLeaves(out, underAbsence);
        }
    }

    protected final void sendUpstream(Command command) {
        CommandHandler<RequirementNode> f = father;
        if (f != null) {
            f.handleUpstream(this, command);
        }
    }

    protected final void sendDownstream(Command command) {
        for (RequirementNode child : children) {
            child.handleDownstream(command);
        }
    }

    protected final void sendDownstream(RequirementNode child, Command command) {
        child.handleDownstream(command);
    }

    protected final RequirementNode child(int index) {
        return children.get(index);
    }

    protected final void emit(RequirementTransition transition) {
        context.sink().onRequirementTransition(
                new RequirementTransitionEvent(context.wallClock().now(), describe(), transition));
    }

    protected final String describeChildren() {
        StringBuilder sb = new StringBuilder();
        for (RequirementNode child : children) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(child.describe());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }
}
