package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.Commands;
import com.questrail.simmonitor.internal.time.Cancellable;
import com.questrail.simmonitor.internal.time.MonotonicScheduler;
import com.questrail.simmonitor.observability.RequirementTransition;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TimedRequirementNode
 * =============================================================================
 * Shared state machine of the five temporal patterns.
 *
 * <h2>Window</h2>
 * An optional window bounds the pattern. When present, a timer is armed at
 * CONNECT; subclasses may re-arm it relative to an observation. An absent
 * window never expires.
 *
 * <h2>Verdicts</h2>
 * A pattern sends at most one terminal command upstream (STATUS_CHANGE or
 * STOP). Once it has concluded, or once it is disconnected, further child
 * reports and timer expiries are ignored.
 *
 * <h2>Timer races</h2>
 * Every arm or cancel bumps a generation counter. An expiry callback carries
 * the generation it was armed with and is discarded if the counter moved on,
 * so a cancelled timer that fires anyway has no effect.
 */
public abstract class TimedRequirementNode extends RequirementNode
{
    /**
     * What a pattern does after a decision taken under its lock.
     */
    protected enum Outcome
    {
        /** Nothing to send. */
        NONE,

        /** Disconnect children, report STATUS_CHANGE. */
        SATISFIED,

        /** Disconnect children, report STOP. */
        VIOLATED,

        /** The window elapsed unsatisfied. Disconnect children, report STOP. */
        EXPIRED,

        /** The window elapsed with the verdict standing. Disconnect children only. */
        WINDOW_CLOSED
    }

    private final Optional<Duration> window;

    // guarded by lock
    protected boolean satisfied;
    private boolean reported;
    private boolean disconnected;
    private Cancellable timer;
    private long timerGeneration;

    protected TimedRequirementNode(
            RequirementContext context,
            Optional<Duration> window,
            List<RequirementNode> children
    ) {
        super(context, children);
        this.window = Objects.requireNonNull(window, "window");
    }

    public final Optional<Duration> window() {
        return window;
    }

    @Override
    public final void handleDownstream(Command command) {
        switch (command.kind()) {
            case CONNECT:
                sendDownstream(command);
                synchronized (lock) {
                    if (!isClosedLocked()) {
                        window.ifPresent(w -> armTimerLocked(
                                MonotonicScheduler.saturatedAdd(context.clock().nowNanos(), w)));
                    }
                }
                break;
            case DISCONNECT:
                synchronized (lock) {
                    boolean first = !disconnected;
                    disconnected = true;
                    cancelTimerLocked();
                    if (first && !reported) {
                        onDisconnectLocked();
                    }
                }
                sendDownstream(command);
                break;
            case TRIGGER:
                synchronized (lock) {
                    if (isClosedLocked()) {
                        return;
                    }
                }
                onTrigger(command);
                break;
            default:
                throw new IllegalArgumentException(command + " is not a downstream command");
        }
    }

    @Override
    public final void handleUpstream(RequirementNode source, Command command) {
        switch (command.kind()) {
            case STATUS_CHANGE:
                onChildReported(source);
                break;
            case STOP:
                Outcome outcome;
                synchronized (lock) {
                    if (isClosedLocked()) {
                        return;
                    }
                    satisfied = false;
                    outcome = concludeLocked(Outcome.VIOLATED);
                }
                apply(outcome);
                break;
            default:
                throw new IllegalArgumentException(command + " is not an upstream command");
        }
    }

    /**
     * Relays an accepted TRIGGER. Called outside the lock.
     */
    protected abstract void onTrigger(Command trigger);

    /**
     * A child reported satisfaction. Called outside the lock.
     */
    protected abstract void onChildReported(RequirementNode source);

    /**
     * The window elapsed before the pattern concluded. Called under the lock.
     */
    protected abstract Outcome onTimeoutLocked();

    /**
     * First DISCONNECT before a verdict. Called under the lock; no commands may be sent.
     */
    protected void onDisconnectLocked() {
    }

    protected final boolean isClosedLocked() {
        return reported || disconnected;
    }

    /**
     * Latches a terminal outcome and cancels the timer.
     */
    protected final Outcome concludeLocked(Outcome outcome) {
        if (outcome != Outcome.NONE) {
            reported = true;
            cancelTimerLocked();
        }
        return outcome;
    }

    /**
     * Re-arms the window to expire at {@code deadlineNanos}.
     */
    protected final void armTimerLocked(long deadlineNanos) {
        cancelTimerLocked();
        long generation = timerGeneration;
        timer = context.scheduler().scheduleAtNanos(deadlineNanos, () -> expire(generation));
    }

    private void cancelTimerLocked() {
        timerGeneration++;
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    private void expire(long generation) {
        Outcome outcome;
        synchronized (lock) {
            if (generation != timerGeneration || isClosedLocked()) {
                return;
            }
            timer = null;
            outcome = concludeLocked(onTimeoutLocked());
        }
        apply(outcome);
    }

    /**
     * Sends the commands for an outcome. Called outside the lock.
     */
    protected final void apply(Outcome outcome) {
        switch (outcome) {
            case SATISFIED:
                emit(RequirementTransition.SATISFIED);
                sendDownstream(Commands.disconnect());
                sendUpstream(Commands.statusChange());
                break;
            case VIOLATED:
                emit(RequirementTransition.VIOLATED);
                sendDownstream(Commands.disconnect());
                sendUpstream(Commands.stop());
                break;
            case EXPIRED:
                emit(RequirementTransition.EXPIRED);
                sendDownstream(Commands.disconnect());
                sendUpstream(Commands.stop());
                break;
            case WINDOW_CLOSED:
                emit(RequirementTransition.WINDOW_CLOSED);
                sendDownstream(Commands.disconnect());
                break;
            default:
                break;
        }
    }

    @Override
    public final boolean isSatisfied() {
        synchronized (lock) {
            return satisfied;
        }
    }

    boolean hasConcluded() {
        synchronized (lock) {
            return reported;
        }
    }

    protected final String describe(String pattern) {
        return pattern + "(" + describeChildren() + ")";
    }
}
