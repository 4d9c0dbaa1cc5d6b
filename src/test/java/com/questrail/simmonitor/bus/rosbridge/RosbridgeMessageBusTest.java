package com.questrail.simmonitor.bus.rosbridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.simmonitor.bus.MessageBusException;
import com.questrail.simmonitor.bus.MessageHandler;
import com.questrail.simmonitor.observability.MonitorTransportEvent;
import com.questrail.simmonitor.observability.RecordingObservabilitySink;
import com.questrail.simmonitor.time.ManualMonotonicClock;
import com.questrail.simmonitor.time.ManualWallClock;
import com.questrail.simmonitor.transport.FakeWebSocketEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RosbridgeMessageBusTest
 * -----------------------------------------------------------------------------
 * rosbridge protocol handling over a fake WebSocket endpoint.
 */
class RosbridgeMessageBusTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private FakeWebSocketEndpoint endpoint;
    private RecordingObservabilitySink sink;
    private RosbridgeMessageBus bus;
    private final List<Throwable> errors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        endpoint = new FakeWebSocketEndpoint();
        sink = new RecordingObservabilitySink();
        bus = newBus(endpoint);
    }

    private RosbridgeMessageBus newBus(FakeWebSocketEndpoint ep) {
        RosbridgeMessageBus b = new RosbridgeMessageBus(ep, "ws://localhost:9090", Duration.ofMillis(100),
                sink, new ManualWallClock(new ManualMonotonicClock()));
        b.setErrorListener(errors::add);
        return b;
    }

    private JsonNode sentFrame(int index) throws Exception {
        return JSON.readTree(endpoint.sent().get(index));
    }

    @Test
    void openWaitsForTheConnection() {
        bus.open();

        assertTrue(endpoint.isStarted());
        assertTrue(sink.getAllEvents().stream().anyMatch(e -> e instanceof MonitorTransportEvent
                && ((MonitorTransportEvent) e).kind() == MonitorTransportEvent.Kind.UP));
    }

    @Test
    void openFailsWhenTheServerNeverAnswers() {
        RosbridgeMessageBus silent = newBus(endpoint.silentOnStart());

        MessageBusException e = assertThrows(MessageBusException.class, silent::open);

        assertTrue(e.getMessage().contains("Timed out"));
        assertTrue(endpoint.isStopped());
    }

    @Test
    void openFailsWithTheConnectCause() {
        ConnectException refused = new ConnectException("Connection refused");
        RosbridgeMessageBus failing = newBus(endpoint.failingOnStart(refused));

        MessageBusException e = assertThrows(MessageBusException.class, failing::open);

        assertSame(refused, e.getCause());
        assertTrue(errors.isEmpty(), "a failed open is not a lost connection");
    }

    @Test
    void firstHandlerSubscribesTheTopic() throws Exception {
        bus.open();

        bus.register("/bump", "std_msgs/Float64", message -> { });

        JsonNode frame = sentFrame(0);
        assertEquals("subscribe", frame.get("op").asText());
        assertEquals("/bump", frame.get("topic").asText());
        assertEquals("std_msgs/Float64", frame.get("type").asText());
        assertTrue(frame.get("id").asText().startsWith("subscribe:/bump:"));
        assertEquals(List.of("/bump"), bus.subscribedTopics());
    }

    @Test
    void handlersOfOneTopicShareASubscription() throws Exception {
        bus.open();
        MessageHandler first = message -> { };
        MessageHandler second = message -> { };

        bus.register("/bump", "std_msgs/Float64", first);
        bus.register("/bump", "std_msgs/Float64", second);
        assertEquals(1, endpoint.sent().size());

        bus.unregister("/bump", "std_msgs/Float64", first);
        assertEquals(1, endpoint.sent().size(), "still one handler left");

        bus.unregister("/bump", "std_msgs/Float64", second);
        JsonNode unsubscribe = sentFrame(1);
        assertEquals("unsubscribe", unsubscribe.get("op").asText());
        assertEquals(sentFrame(0).get("id").asText(), unsubscribe.get("id").asText());
        assertTrue(bus.subscribedTopics().isEmpty());
    }

    @Test
    void conflictingTypeOnOneTopicIsRejected() {
        bus.open();
        bus.register("/bump", "std_msgs/Float64", message -> { });

        assertThrows(IllegalArgumentException.class,
                () -> bus.register("/bump", "std_msgs/Int32", message -> { }));
    }

    @Test
    void unregisteringAnUnknownHandlerDoesNothing() {
        bus.open();
        bus.register("/bump", "std_msgs/Float64", message -> { });

        bus.unregister("/bump", "std_msgs/Float64", message -> { });
        bus.unregister("/other", "std_msgs/Float64", message -> { });

        assertEquals(1, endpoint.sent().size());
    }

    @Test
    void publishIsDeliveredAsANestedMap() {
        bus.open();
        List<Map<String, Object>> received = new ArrayList<>();
        bus.register("/odom", "nav_msgs/Odometry", received::add);

        endpoint.injectText("{\"op\":\"publish\",\"topic\":\"/odom\","
                + "\"msg\":{\"pose\":{\"position\":{\"x\":1.5,\"y\":2}},\"frame\":\"map\"}}");

        assertEquals(1, received.size());
        Map<?, ?> pose = (Map<?, ?>) received.get(0).get("pose");
        Map<?, ?> position = (Map<?, ?>) pose.get("position");
        assertEquals(1.5, position.get("x"));
        assertEquals(2, position.get("y"));
        assertEquals("map", received.get(0).get("frame"));
    }

    @Test
    void publishOnAnUnsubscribedTopicIsIgnored() {
        bus.open();

        endpoint.injectText("{\"op\":\"publish\",\"topic\":\"/nobody\",\"msg\":{}}");

        assertTrue(errors.isEmpty());
    }

    @Test
    void handlerFailureGoesToTheErrorListenerAndDeliveryContinues() {
        bus.open();
        IllegalStateException boom = new IllegalStateException("no key 'z'");
        List<Map<String, Object>> received = new ArrayList<>();
        bus.register("/bump", "std_msgs/Float64", message -> { throw boom; });
        bus.register("/bump", "std_msgs/Float64", received::add);

        endpoint.injectText("{\"op\":\"publish\",\"topic\":\"/bump\",\"msg\":{\"data\":3.0}}");

        assertEquals(List.of(boom), errors);
        assertEquals(1, received.size());
    }

    @Test
    void malformedFrameIsAnError() {
        bus.open();

        endpoint.injectText("{not json");

        assertEquals(1, errors.size());
        assertInstanceOf(MessageBusException.class, errors.get(0));
    }

    @Test
    void publishWithoutAMessageObjectIsAnError() {
        bus.open();
        bus.register("/bump", "std_msgs/Float64", message -> { });

        endpoint.injectText("{\"op\":\"publish\",\"topic\":\"/bump\",\"msg\":42}");

        assertEquals(1, errors.size());
    }

    @Test
    void statusFrameIsReportedToTheSink() {
        bus.open();

        endpoint.injectText("{\"op\":\"status\",\"level\":\"error\",\"msg\":\"unknown topic type\"}");

        assertEquals(1, sink.getErrors().size());
        assertEquals("rosbridge error: unknown topic type", sink.getErrors().get(0).message());
        assertTrue(errors.isEmpty());
    }

    @Test
    void lostConnectionIsAnError() {
        bus.open();

        endpoint.dropConnection(new IOException("reset by peer"));

        assertEquals(1, errors.size());
        assertTrue(errors.get(0).getMessage().contains("lost"));
    }

    @Test
    void closeIsQuietAndIdempotent() {
        bus.open();
        bus.register("/bump", "std_msgs/Float64", message -> { });

        bus.close();
        bus.close();

        assertTrue(endpoint.isStopped());
        assertTrue(errors.isEmpty());
    }

    @Test
    void unregisterAfterCloseSendsNothing() {
        bus.open();
        MessageHandler handler = message -> { };
        bus.register("/bump", "std_msgs/Float64", handler);
        bus.close();

        bus.unregister("/bump", "std_msgs/Float64", handler);

        assertEquals(1, endpoint.sent().size());
        assertTrue(bus.subscribedTopics().isEmpty());
    }

    @Test
    void withoutAListenerErrorsReachTheSink() {
        RosbridgeMessageBus unattended = new RosbridgeMessageBus(endpoint, "ws://localhost:9090",
                Duration.ofMillis(100), sink);
        unattended.open();

        endpoint.injectText("garbage");

        assertEquals(1, sink.getErrors().size());
    }
}
