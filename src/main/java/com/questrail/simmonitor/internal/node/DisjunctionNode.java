package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.Command;
import com.questrail.simmonitor.internal.command.Commands;
import com.questrail.simmonitor.observability.RequirementTransition;

import java.util.ArrayList;
import java.util.List;

/**
 * Either of two events.
 *
 * <p>Downstream commands are relayed to both children. The disjunction reports
 * upstream once, for the first child to report after the trigger, and then
 * disconnects the other child. The latched timestamp is the earliest among the
 * alternatives that were satisfied at that point. When both were already
 * satisfied as the trigger arrives, the earlier one is latched, not the one
 * the trigger happened to reach first.</p>
 */
public final class DisjunctionNode extends RequirementNode
{
    // guarded by lock
    private boolean triggered;
    private boolean reported;
    private boolean disconnected;
    private boolean relayingTrigger;
    private final List<RequirementNode> reporters = new ArrayList<>(2);
    private long reportedAt = NEVER;

    public DisjunctionNode(RequirementContext context, RequirementNode first, RequirementNode second) {
        super(context, List.of(first, second));
    }

    @Override
    public void handleDownstream(Command command) {
        switch (command.kind()) {
            case CONNECT:
                sendDownstream(command);
                break;
            case DISCONNECT:
                synchronized (lock) {
                    disconnected = true;
                }
                sendDownstream(command);
                break;
            case TRIGGER:
                onTrigger(command);
                break;
            default:
                throw new IllegalArgumentException(command + " is not a downstream command");
        }
    }

    @Override
    public void handleUpstream(RequirementNode source, Command command) {
        switch (command.kind()) {
            case STATUS_CHANGE:
                onChildReported(source);
                break;
            case STOP:
                sendUpstream(command);
                break;
            default:
                throw new IllegalArgumentException(command + " is not an upstream command");
        }
    }

    /**
     * Children reporting while the trigger is still being relayed are held
     * back until both children have seen it.
     */
    private void onTrigger(Command command) {
        synchronized (lock) {
            if (reported || disconnected) {
                return;
            }
            triggered = true;
            relayingTrigger = true;
        }
        try {
            for (RequirementNode child : children()) {
                synchronized (lock) {
                    if (reported || disconnected) {
                        return;
                    }
                }
                sendDownstream(child, command);
            }
        } finally {
            synchronized (lock) {
                relayingTrigger = false;
            }
        }

        report();
    }

    private void onChildReported(RequirementNode source) {
        synchronized (lock) {
            if (reported || disconnected || !triggered) {
                return;
            }
            if (!reporters.contains(source)) {
                reporters.add(source);
            }
            if (relayingTrigger) {
                return;
            }
        }
        report();
    }

    private void report() {
        List<RequirementNode> losers = new ArrayList<>(2);
        synchronized (lock) {
            if (reported || disconnected) {
                return;
            }
            RequirementNode winner = null;
            for (RequirementNode reporter : reporters) {
                if (winner == null || reporter.lastSatisfiedAt() < winner.lastSatisfiedAt()) {
                    winner = reporter;
                }
            }
            if (winner == null) {
                return;
            }
            reported = true;
            reportedAt = winner.lastSatisfiedAt();
            for (RequirementNode child : children()) {
                if (child != winner) {
                    losers.add(child);
                }
            }
        }
        for (RequirementNode loser : losers) {
            sendDownstream(loser, Commands.disconnect());
        }
        emit(RequirementTransition.SATISFIED);
        sendUpstream(Commands.statusChange());
    }

    @Override
    public boolean isSatisfied() {
        synchronized (lock) {
            if (reported) {
                return true;
            }
        }
        return child(0).isSatisfied() || child(1).isSatisfied();
    }

    /**
     * The winning child's timestamp once reported; before that, the earliest
     * satisfied child's.
     */
    @Override
    public long lastSatisfiedAt() {
        synchronized (lock) {
            if (reported) {
                return reportedAt;
            }
        }
        long earliest = NEVER;
        for (RequirementNode child : children()) {
            if (child.isSatisfied()) {
                long at = child.lastSatisfiedAt();
                if (earliest == NEVER || at < earliest) {
                    earliest = at;
                }
            }
        }
        return earliest;
    }

    @Override
    public String describe() {
        return "or(" + describeChildren() + ")";
    }
}
