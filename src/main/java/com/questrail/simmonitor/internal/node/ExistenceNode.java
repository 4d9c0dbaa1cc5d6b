package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.Command;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * P eventually occurs, within the window if one is given.
 */
public final class ExistenceNode extends TimedRequirementNode
{
    public ExistenceNode(RequirementContext context, Optional<Duration> window, RequirementNode event) {
        super(context, window, List.of(event));
    }

    @Override
    protected void onTrigger(Command trigger) {
        sendDownstream(trigger);
    }

    @Override
    protected void onChildReported(RequirementNode source) {
        Outcome outcome;
        synchronized (lock) {
            if (isClosedLocked() || !source.isSatisfied()) {
                return;
            }
            satisfied = true;
            outcome = concludeLocked(Outcome.SATISFIED);
        }
        apply(outcome);
    }

    @Override
    protected Outcome onTimeoutLocked() {
        return satisfied ? Outcome.SATISFIED : Outcome.EXPIRED;
    }

    @Override
    public String describe() {
        return describe("existence");
    }
}
