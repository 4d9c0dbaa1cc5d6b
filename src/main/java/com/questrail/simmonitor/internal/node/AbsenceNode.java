package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.api.LeafReport;
import com.questrail.simmonitor.internal.command.Command;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * P never occurs.
 *
 * <p>Satisfied from the start. The first report of P is a violation. When a
 * window is given and elapses without a violation, the verdict becomes final
 * and P is no longer observed.</p>
 *
 * <p>In reports, the forbidden event's label is inverted: an event that was
 * seen is shown UNSATISFIED.</p>
 */
public final class AbsenceNode extends TimedRequirementNode
{
    public AbsenceNode(RequirementContext context, Optional<Duration> window, RequirementNode event) {
        super(context, window, List.of(event));
        this.satisfied = true;
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
            satisfied = false;
            outcome = concludeLocked(Outcome.VIOLATED);
        }
        apply(outcome);
    }

    @Override
    protected Outcome onTimeoutLocked() {
        return satisfied ? Outcome.WINDOW_CLOSED : Outcome.EXPIRED;
    }

    @Override
    public void collectLeaves(List<LeafReport> out, boolean underAbsence) {
        super.collectLeaves(out, !underAbsence);
    }

    @Override
    public String describe() {
        return describe("absence");
    }
}
