package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.Commands;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Once P occurs, Q does not occur afterward. Children: {@code [P, Q]}.
 *
 * <p>Q is only observed after P, from P's timestamp on. Any Q then is a
 * violation. The pattern is satisfied when its window elapses with P seen and
 * no Q after it; without a window it stays unsatisfied until disconnected,
 * when the same test fixes its final state.</p>
 */
public final class PreventionNode extends TimedRequirementNode
{
    // guarded by lock
    private boolean posteriorTriggered;
    private boolean posteriorObserved;

    public PreventionNode(
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
            } else if (source == posterior()) {
                posteriorObserved = true;
                satisfied = false;
                outcome = concludeLocked(Outcome.VIOLATED);
            }
        }

        if (triggerPosterior) {
            sendDownstream(posterior(), Commands.trigger(anteriorAt));
        }
        apply(outcome);
    }

    private boolean holdsLocked() {
        return posteriorTriggered && anterior().isSatisfied() && !posteriorObserved;
    }

    @Override
    protected Outcome onTimeoutLocked() {
        satisfied = holdsLocked();
        return satisfied ? Outcome.SATISFIED : Outcome.EXPIRED;
    }

    @Override
    protected void onDisconnectLocked() {
        satisfied = holdsLocked();
    }

    @Override
    public String describe() {
        return describe("prevention");
    }
}
