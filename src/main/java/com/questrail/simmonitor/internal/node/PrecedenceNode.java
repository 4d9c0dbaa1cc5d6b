package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.Command;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Q only occurs after a prior P. Children: {@code [Q, P]}.
 *
 * <p>Both events are observed from arming. Q occurring with no earlier P is a
 * violation reported at once, without waiting for the window.</p>
 */
public final class PrecedenceNode extends TimedRequirementNode
{
    public PrecedenceNode(
            RequirementContext context,
            Optional<Duration> window,
            RequirementNode consequent,
            RequirementNode antecedent
    ) {
        super(context, window, List.of(consequent, antecedent));
    }

    private RequirementNode consequent() {
        return child(0);
    }

    private RequirementNode antecedent() {
        return child(1);
    }

    @Override
    protected void onTrigger(Command trigger) {
        sendDownstream(antecedent(), trigger);
        synchronized (lock) {
            if (isClosedLocked()) {
                return;
            }
        }
        sendDownstream(consequent(), trigger);
    }

    @Override
    protected void onChildReported(RequirementNode source) {
        Outcome outcome;
        synchronized (lock) {
            if (isClosedLocked()) {
                return;
            }
            RequirementNode q = consequent();
            RequirementNode p = antecedent();
            if (!q.isSatisfied()) {
                return;
            }
            if (p.isSatisfied() && p.lastSatisfiedAt() < q.lastSatisfiedAt()) {
                satisfied = true;
                outcome = concludeLocked(Outcome.SATISFIED);
            } else {
                outcome = concludeLocked(Outcome.VIOLATED);
            }
        }
        apply(outcome);
    }

    @Override
    protected Outcome onTimeoutLocked() {
        return satisfied ? Outcome.SATISFIED : Outcome.EXPIRED;
    }

    @Override
    public String describe() {
        return describe("precedence");
    }
}
