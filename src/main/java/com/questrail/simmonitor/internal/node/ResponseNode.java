package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.Commands;
import com.questrail.simmonitor.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * P is followed by Q within the window. Children: {@code [P, Q]}.
 *
 * <p>Only P is triggered from above. When P reports, Q is triggered with P's
 * timestamp and the window restarts from that timestamp, so Q must occur in
 * {@code (P.at, P.at + window]}.</p>
 */
public final class ResponseNode extends TimedRequirementNode
{
    // guarded by lock
    private boolean posteriorTriggered;

    public ResponseNode(
            RequirementContext context,
            Optional<Duration> window,
            RequirementNode anterior,
            RequirementNode posterior
    ) {
        super(context, window, List.of(anterior, posterior));
    }

    private RequirementNode anterior() {
        return child(0);
    }

    private RequirementNode posterior() {
        return child(1);
    }

    @Override
    protected void onTrigger(Command trigger) {
        sendDownstream(anterior(), trigger);
    }

    @Override
    protected void onChildReported(RequirementNode source) {
        Outcome outcome = Outcome.NONE;
        long anteriorAt = NEVER;
        boolean triggerPosterior = false;

        synchronized (lock) {
            if (isClosedLocked()) {
                return;
            }
            if (!posteriorTriggered) {
                if (source != anterior()) {
                    return;
                }
                posteriorTriggered = true;
                triggerPosterior = true;
                anteriorAt = anterior().lastSatisfiedAt();
                long from = anteriorAt;
                window().ifPresent(w -> armTimerLocked(MonotonicScheduler.saturatedAdd(from, w)));
            } else if (source == posterior() && anterior().isSatisfied() && posterior().isSatisfied()) {
                satisfied = true;
                outcome = concludeLocked(Outcome.SATISFIED);
            }
        }

        if (triggerPosterior) {
            sendDownstream(posterior(), Commands.trigger(anteriorAt));
        }
        apply(outcome);
    }

    @Override
    protected Outcome onTimeoutLocked() {
        return satisfied ? Outcome.SATISFIED : Outcome.EXPIRED;
    }

    @Override
    public String describe() {
        return describe("response");
    }
}
