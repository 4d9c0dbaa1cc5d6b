package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.api.LeafReport;
import com.questrail.simmonitor.bus.MessageBus;
import com.questrail.simmonitor.bus.MessageHandler;
import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.Commands;
import com.questrail.simmonitor.internal.predicate.MessagePredicate;
import com.questrail.simmonitor.observability.RequirementTransition;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SimpleEventNode
 * =============================================================================
 * Leaf of a requirement tree: one topic, one message type, one predicate.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>CONNECT registers a handler for the topic on the carried bus.</li>
 *   <li>Every matching message marks the leaf satisfied and stamps it.</li>
 *   <li>Once triggered at {@code ts}, the first satisfaction stamped strictly
 *       after {@code ts} is reported upstream, exactly once. The leaf then
 *       unsubscribes. A satisfaction already recorded when the trigger arrives
 *       is reported immediately if it is newer than {@code ts}.</li>
 *   <li>DISCONNECT unsubscribes. Repeating it has no effect.</li>
 * </ol>
 *
 * <p>Predicate evaluation happens outside the node lock. Evaluation failures
 * propagate to the bus, which routes them to the run's error handling.</p>
 */
public final class SimpleEventNode extends RequirementNode
{
    private final String topic;
    private final String messageType;
    private final MessagePredicate predicate;
    private final String predicateText;
    private final MessageHandler handler = this::onMessage;

    // guarded by lock
    private MessageBus bus;
    private boolean subscribed;
    private boolean triggered;
    private long triggeredAt;
    private boolean satisfied;
    private long satisfiedAt = NEVER;
    private Instant satisfiedWallTime;
    private boolean reported;

    public SimpleEventNode(
            RequirementContext context,
            String topic,
            String messageType,
            MessagePredicate predicate,
            String predicateText
    ) {
        super(context, List.of());
        this.topic = Objects.requireNonNull(topic, "topic");
        this.messageType = Objects.requireNonNull(messageType, "messageType");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.predicateText = Objects.requireNonNull(predicateText, "predicateText");
    }

    public String topic() {
        return topic;
    }

    public String messageType() {
        return messageType;
    }

    @Override
    public void handleDownstream(Command command) {
        switch (command.kind()) {
            case CONNECT:
                connect(command.bus());
                break;
            case DISCONNECT:
                disconnect();
                break;
            case TRIGGER:
                trigger(command.timestamp());
                break;
            default:
                throw new IllegalArgumentException(command + " is not a downstream command");
        }
    }

    @Override
    public void handleUpstream(RequirementNode source, Command command) {
        throw new IllegalStateException("A simple event has no children, got " + command + " from " + source);
    }

    private void connect(MessageBus target) {
        synchronized (lock) {
            if (subscribed || reported) {
                return;
            }
            bus = target;
            subscribed = true;
        }
        target.register(topic, messageType, handler);
    }

    private void disconnect() {
        MessageBus target;
        synchronized (lock) {
            if (!subscribed) {
                return;
            }
            subscribed = false;
            target = bus;
        }
        target.unregister(topic, messageType, handler);
    }

    private void trigger(long timestamp) {
        MessageBus target;
        synchronized (lock) {
            if (reported) {
                return;
            }
            triggered = true;
            triggeredAt = timestamp;
            target = reportIfDueLocked();
        }
        emit(RequirementTransition.TRIGGERED);
        if (target != null) {
            report(target);
        }
    }

    private void onMessage(Map<String, Object> message) {
        synchronized (lock) {
            if (!subscribed || reported) {
                return;
            }
        }

        if (!predicate.test(message)) {
            return;
        }

        MessageBus target;
        synchronized (lock) {
            if (!subscribed || reported) {
                return;
            }
            satisfied = true;
            satisfiedAt = context.clock().nowNanos();
            satisfiedWallTime = context.wallClock().now();
            target = reportIfDueLocked();
        }
        if (target != null) {
            report(target);
        }
    }

    /**
     * Latches the report and hands back the bus to unsubscribe from, or
     * {@code null} when nothing is due.
     */
    private MessageBus reportIfDueLocked() {
        if (!triggered || !satisfied || !subscribed || satisfiedAt <= triggeredAt) {
            return null;
        }
        reported = true;
        subscribed = false;
        return bus;
    }

    private void report(MessageBus target) {
        target.unregister(topic, messageType, handler);
        emit(RequirementTransition.SATISFIED);
        sendUpstream(Commands.statusChange());
    }

    @Override
    public boolean isSatisfied() {
        synchronized (lock) {
            return satisfied;
        }
    }

    @Override
    public long lastSatisfiedAt() {
        synchronized (lock) {
            return satisfiedAt;
        }
    }

    boolean isSubscribed() {
        synchronized (lock) {
            return subscribed;
        }
    }

    boolean hasReported() {
        synchronized (lock) {
            return reported;
        }
    }

    @Override
    public void collectLeaves(List<LeafReport> out, boolean underAbsence) {
        synchronized (lock) {
            out.add(new LeafReport(
                    topic,
                    underAbsence != satisfied,
                    Optional.ofNullable(satisfiedWallTime),
                    predicateText));
        }
    }

    @Override
    public String describe() {
        return "event(" + topic + ")";
    }
}
