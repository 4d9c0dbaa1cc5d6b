package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.api.LeafReport;
import com.questrail.simmonitor.api.MonitorReport;
import com.questrail.simmonitor.api.MonitorVerdict;
import com.questrail.simmonitor.bus.MessageBus;
import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.CommandHandler;
import com.questrail.simmonitor.internal.command.Commands;
import com.questrail.simmonitor.internal.time.Cancellable;
import com.questrail.simmonitor.observability.MonitorErrorEvent;
import com.questrail.simmonitor.observability.MonitorFinishedEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * MonitorCoordinator
 * =============================================================================
 * Root of the requirement forest. Owns one subtree per requirement and decides
 * when the run is over.
 *
 * <h2>Timers</h2>
 * <ul>
 *   <li><b>Ignore window</b> ({@code minTimeout}): messages are received and
 *       recorded from {@link #start(MessageBus)}, but nothing is evaluated
 *       until it elapses. At that point the coordinator sends TRIGGER since
 *       start to every subtree, and only then becomes <i>armed</i> and checks
 *       whether all requirements already hold.</li>
 *   <li><b>Deadline</b> ({@code maxTimeout}): ends the run unconditionally.</li>
 * </ul>
 *
 * <h2>Termination</h2>
 * The run finishes exactly once, for the first of:
 * <ul>
 *   <li>every requirement satisfied after arming: {@link MonitorVerdict#SATISFIED}</li>
 *   <li>a requirement sent STOP: {@link MonitorVerdict#VIOLATED}</li>
 *   <li>the deadline: {@link MonitorVerdict#TIMED_OUT}</li>
 *   <li>{@link #abort()}: {@link MonitorVerdict#ABORTED}</li>
 *   <li>{@link #fail(Throwable)}: {@link MonitorVerdict#FAILED}</li>
 * </ul>
 * Finishing cancels both timers, disconnects every subtree, and releases
 * {@link #awaitFinished()}. With no requirements the run lasts until the
 * deadline.
 */
public final class MonitorCoordinator implements CommandHandler<RequirementNode>
{
    private final Object lock = new Object();
    private final RequirementContext context;
    private final Duration maxTimeout;
    private final Duration minTimeout;
    private final CountDownLatch finishedLatch = new CountDownLatch(1);

    private volatile List<RequirementNode> children = List.of();
    private volatile boolean finished;

    // guarded by lock
    private boolean started;
    private boolean armed;
    private MonitorVerdict verdict = MonitorVerdict.RUNNING;
    private Throwable failure;
    private Cancellable ignoreTimer;
    private Cancellable deadlineTimer;

    public MonitorCoordinator(RequirementContext context, Duration maxTimeout) {
        this(context, maxTimeout, Duration.ZERO);
    }

    public MonitorCoordinator(RequirementContext context, Duration maxTimeout, Duration minTimeout) {
        this.context = Objects.requireNonNull(context, "context");
        this.maxTimeout = Objects.requireNonNull(maxTimeout, "maxTimeout");
        this.minTimeout = Objects.requireNonNull(minTimeout, "minTimeout");
        if (maxTimeout.isNegative() || minTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must be >= 0");
        }
    }

    /**
     * Takes ownership of one requirement subtree.
     *
     * @throws IllegalStateException if the run already started, or the node has a father
     */
    public void adopt(RequirementNode requirement) {
        Objects.requireNonNull(requirement, "requirement");
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Cannot adopt requirements after start");
            }
            requirement.adoptBy(this);
            List<RequirementNode> next = new ArrayList<>(children);
            next.add(requirement);
            children = List.copyOf(next);
        }
    }

    public void adoptAll(Collection<? extends RequirementNode> requirements) {
        for (RequirementNode requirement : requirements) {
            adopt(requirement);
        }
    }

    public List<RequirementNode> requirements() {
        return children;
    }

    /**
     * Connects every subtree to {@code bus}, then starts both timers.
     *
     * @throws IllegalStateException if called twice
     */
    public void start(MessageBus bus) {
        Objects.requireNonNull(bus, "bus");
        synchronized (lock) {
            if (started) {
                throw new IllegalStateException("Coordinator already started");
            }
            started = true;
            if (verdict.isTerminal()) {
                return;
            }
        }

        Command connect = Commands.connect(bus);
        for (RequirementNode child : children) {
            child.handleDownstream(connect);
        }

        synchronized (lock) {
            if (verdict.isTerminal()) {
                return;
            }
            ignoreTimer = context.scheduler().scheduleAfter(minTimeout, context.clock(), this::onIgnoreWindowElapsed);
            deadlineTimer = context.scheduler().scheduleAfter(maxTimeout, context.clock(), this::onDeadline);
        }
    }

    private void onIgnoreWindowElapsed() {
        synchronized (lock) {
            ignoreTimer = null;
            if (verdict.isTerminal()) {
                return;
            }
        }

        // Armed only once every requirement has seen the trigger.
        Command trigger = Commands.triggerSinceStart();
        for (RequirementNode child : children) {
            if (verdict().isTerminal()) {
                return;
            }
            child.handleDownstream(trigger);
        }

        synchronized (lock) {
            if (verdict.isTerminal()) {
                return;
            }
            armed = true;
        }
        reevaluate();
    }

    private void onDeadline() {
        finish(MonitorVerdict.TIMED_OUT, null);
    }

    private void reevaluate() {
        synchronized (lock) {
            if (verdict.isTerminal() || !armed || children.isEmpty()) {
                return;
            }
            for (RequirementNode child : children) {
                if (!child.isSatisfied()) {
                    return;
                }
            }
        }
        finish(MonitorVerdict.SATISFIED, null);
    }

    @Override
    public void handleUpstream(RequirementNode source, Command command) {
        switch (command.kind()) {
            case STATUS_CHANGE:
                reevaluate();
                break;
            case STOP:
                finish(MonitorVerdict.VIOLATED, null);
                break;
            default:
                throw new IllegalArgumentException(command + " is not an upstream command");
        }
    }

    @Override
    public void handleDownstream(Command command) {
        throw new IllegalStateException("The coordinator is the root; it receives no downstream commands");
    }

    /**
     * Ends the run on operator request. Safe to call at any time, any number of times.
     */
    public void abort() {
        finish(MonitorVerdict.ABORTED, null);
    }

    /**
     * Ends the run because of an error outside the requirement logic, such as
     * a predicate that cannot be evaluated against a delivered message.
     */
    public void fail(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        context.sink().onError(new MonitorErrorEvent(context.wallClock().now(), describeFailure(cause), cause));
        finish(MonitorVerdict.FAILED, cause);
    }

    private static String describeFailure(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private void finish(MonitorVerdict outcome, Throwable cause) {
        synchronized (lock) {
            if (verdict.isTerminal()) {
                return;
            }
            verdict = outcome;
            failure = cause;
            if (ignoreTimer != null) {
                ignoreTimer.cancel();
                ignoreTimer = null;
            }
            if (deadlineTimer != null) {
                deadlineTimer.cancel();
                deadlineTimer = null;
            }
        }

        try {
            Command disconnect = Commands.disconnect();
            for (RequirementNode child : children) {
                child.handleDownstream(disconnect);
            }
            context.sink().onRunFinished(new MonitorFinishedEvent(context.wallClock().now(), outcome, report()));
        } finally {
            finished = true;
            finishedLatch.countDown();
        }
    }

    public boolean isFinished() {
        return finished;
    }

    public void awaitFinished() throws InterruptedException {
        finishedLatch.await();
    }

    /**
     * @return {@code true} if the run finished within {@code timeout}
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finishedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isArmed() {
        synchronized (lock) {
            return armed;
        }
    }

    public MonitorVerdict verdict() {
        synchronized (lock) {
            return verdict;
        }
    }

    public Optional<Throwable> failure() {
        synchronized (lock) {
            return Optional.ofNullable(failure);
        }
    }

    /**
     * Snapshot of every simple event, grouped by requirement.
     */
    public MonitorReport report() {
        List<List<LeafReport>> requirements = new ArrayList<>();
        for (RequirementNode child : children) {
            List<LeafReport> leaves = new ArrayList<>();
            child.collectLeaves(leaves, false);
            requirements.add(leaves);
        }
        return new MonitorReport(verdict(), requirements);
    }
}
