package com.questrail.simmonitor.internal.node;

import com.questrail.simmonitor.internal.command.CommandKind;
import com.questrail.simmonitor.internal.command.Commands;
import com.questrail.simmonitor.observability.RequirementTransition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.simmonitor.internal.node.NodeFixture.msg;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DisjunctionNodeTest
 * -----------------------------------------------------------------------------
 * Single report of event disjunctions, and which alternative's timestamp they
 * latch.
 */
class DisjunctionNodeTest {

    private final NodeFixture f = new NodeFixture();

    @Test
    void firstChildToReportWinsAndTheOtherIsDisconnected() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        NodeFixture.RecordingFather father = f.adoptedByRecorder(or);

        or.handleDownstream(Commands.connect(f.bus));
        or.handleDownstream(Commands.triggerSinceStart());
        f.clock.advanceMillis(500);
        f.bus.publish("/right", msg());

        assertEquals(List.of(CommandKind.STATUS_CHANGE), father.received());
        assertTrue(or.isSatisfied());
        assertEquals(500_000_000L, or.lastSatisfiedAt());
        assertFalse(f.bus.hasSubscriptions());
    }

    @Test
    void reportsUpstreamOnlyOnce() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        NodeFixture.RecordingFather father = f.adoptedByRecorder(or);

        or.handleDownstream(Commands.connect(f.bus));
        f.bus.publish("/left", msg());
        f.bus.publish("/right", msg());
        or.handleDownstream(Commands.triggerSinceStart());

        assertEquals(List.of(CommandKind.STATUS_CHANGE), father.received());
    }

    @Test
    void bothAlternativesSeenBeforeTriggerLatchTheEarlierOne() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        NodeFixture.RecordingFather father = f.adoptedByRecorder(or);
        or.handleDownstream(Commands.connect(f.bus));

        f.clock.advanceMillis(1000);
        f.bus.publish("/right", msg());
        f.clock.advanceMillis(4000);
        f.bus.publish("/left", msg());
        or.handleDownstream(Commands.triggerSinceStart());

        assertEquals(List.of(CommandKind.STATUS_CHANGE), father.received());
        assertEquals(1_000_000_000L, or.lastSatisfiedAt(), "the trigger reaches /left first, but /right came first");
        assertFalse(f.bus.hasSubscriptions());
    }

    @Test
    void alternativeAlreadySeenAtTriggerStillLetsTheOtherBeTriggeredThenDisconnectsIt() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        NodeFixture.RecordingFather father = f.adoptedByRecorder(or);
        or.handleDownstream(Commands.connect(f.bus));

        f.clock.advanceMillis(1000);
        f.bus.publish("/left", msg());
        or.handleDownstream(Commands.triggerSinceStart());

        assertEquals(List.of(RequirementTransition.TRIGGERED), f.sink.transitionsOf("event(/right)"));
        assertEquals(List.of(RequirementTransition.SATISFIED), f.sink.transitionsOf("or(event(/left), event(/right))"));
        assertFalse(f.bus.hasSubscriptions());

        f.clock.advanceMillis(1000);
        f.bus.publish("/right", msg());

        assertFalse(right.isSatisfied());
        assertEquals(List.of(CommandKind.STATUS_CHANGE), father.received());
        assertEquals(1_000_000_000L, or.lastSatisfiedAt());
    }

    @Test
    void alternativeSeenOnlyBeforeTheTriggerTimestampDoesNotCount() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        NodeFixture.RecordingFather father = f.adoptedByRecorder(or);
        or.handleDownstream(Commands.connect(f.bus));

        f.clock.advanceMillis(1000);
        f.bus.publish("/right", msg());
        f.clock.advanceMillis(1000);
        or.handleDownstream(Commands.trigger(f.clock.nowNanos()));
        assertTrue(father.received().isEmpty());

        f.clock.advanceMillis(1000);
        f.bus.publish("/left", msg());

        assertEquals(List.of(CommandKind.STATUS_CHANGE), father.received());
        assertEquals(3_000_000_000L, or.lastSatisfiedAt());
    }

    @Test
    void beforeReportingTimestampIsTheEarliestSatisfiedChild() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        or.handleDownstream(Commands.connect(f.bus));

        assertFalse(or.isSatisfied());
        assertEquals(RequirementNode.NEVER, or.lastSatisfiedAt());

        f.clock.advanceMillis(2000);
        f.bus.publish("/right", msg());
        f.clock.advanceMillis(1000);
        f.bus.publish("/left", msg());

        assertTrue(or.isSatisfied());
        assertEquals(2_000_000_000L, or.lastSatisfiedAt());
    }

    @Test
    void triggerAfterDisconnectIsNotRelayed() {
        SimpleEventNode left = f.anyMessage("/left");
        SimpleEventNode right = f.anyMessage("/right");
        DisjunctionNode or = new DisjunctionNode(f.context, left, right);
        NodeFixture.RecordingFather father = f.adoptedByRecorder(or);
        or.handleDownstream(Commands.connect(f.bus));
        f.bus.publish("/left", msg());

        or.handleDownstream(Commands.disconnect());
        or.handleDownstream(Commands.triggerSinceStart());

        assertTrue(father.received().isEmpty());
        assertFalse(left.hasReported());
    }

    @Test
    void describesBothOperands() {
        DisjunctionNode or = new DisjunctionNode(f.context, f.anyMessage("/a"), f.anyMessage("/b"));

        assertEquals("or(event(/a), event(/b))", or.describe());
    }
}
