package com.questrail.simmonitor.bus.rosbridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.simmonitor.bus.ManagedMessageBus;
import com.questrail.simmonitor.bus.MessageBusException;
import com.questrail.simmonitor.bus.MessageHandler;
import com.questrail.simmonitor.internal.time.SystemWallClock;
import com.questrail.simmonitor.internal.time.WallClock;
import com.questrail.simmonitor.observability.MonitorErrorEvent;
import com.questrail.simmonitor.observability.MonitorObservabilitySink;
import com.questrail.simmonitor.observability.MonitorTransportEvent;
import com.questrail.simmonitor.observability.NullObservabilitySink;
import com.questrail.simmonitor.transport.WebSocketEndpoint;
import com.questrail.simmonitor.transport.WebSocketEndpointListener;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * RosbridgeMessageBus
 * =============================================================================
 * {@link ManagedMessageBus} speaking the rosbridge v2 JSON protocol over a
 * {@link WebSocketEndpoint}.
 *
 * <h2>Protocol subset</h2>
 * <ul>
 *   <li>outbound {@code {"op":"subscribe","id":..,"topic":..,"type":..}}</li>
 *   <li>outbound {@code {"op":"unsubscribe","id":..,"topic":..}}</li>
 *   <li>inbound {@code {"op":"publish","topic":..,"msg":{..}}}</li>
 *   <li>inbound {@code {"op":"status",..}}, reported to the sink</li>
 * </ul>
 *
 * <h2>Subscriptions</h2>
 * All handlers of one topic share a single rosbridge subscription. It is
 * opened with the first handler and closed with the last. A topic can only
 * be subscribed with one message type at a time.
 *
 * <h2>Errors</h2>
 * Exceptions thrown by handlers, malformed frames, and an unexpected loss of
 * the connection are passed to the error listener. Delivery to the remaining
 * handlers continues.
 */
public final class RosbridgeMessageBus implements ManagedMessageBus, WebSocketEndpointListener
{
    private static final ObjectMapper MAPPER = JsonMapper.builder().build();
    private static final TypeReference<Map<String, Object>> MESSAGE_TYPE = new TypeReference<>() {};

    private final WebSocketEndpoint endpoint;
    private final String address;
    private final Duration connectTimeout;
    private final MonitorObservabilitySink sink;
    private final WallClock wallClock;

    private final Object lock = new Object();
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final CountDownLatch settled = new CountDownLatch(1);

    private volatile Consumer<Throwable> errorListener;
    private volatile boolean up;
    private volatile boolean closed;
    private volatile Throwable connectFailure;

    public RosbridgeMessageBus(
            WebSocketEndpoint endpoint,
            String address,
            Duration connectTimeout,
            MonitorObservabilitySink sink,
            WallClock wallClock
    ) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.address = Objects.requireNonNull(address, "address");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.errorListener = this::reportUnhandled;
    }

    public RosbridgeMessageBus(WebSocketEndpoint endpoint, String address, Duration connectTimeout,
                               MonitorObservabilitySink sink) {
        this(endpoint, address, connectTimeout, sink, SystemWallClock.INSTANCE);
    }

    @Override
    public void setErrorListener(Consumer<Throwable> listener) {
        this.errorListener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void open() {
        endpoint.setListener(this);
        endpoint.start();

        boolean done;
        try {
            done = settled.await(connectTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            endpoint.stop();
            throw new MessageBusException("Interrupted while connecting to rosbridge at " + address, e);
        }

        if (!done) {
            endpoint.stop();
            throw new MessageBusException("Timed out after " + connectTimeout + " connecting to rosbridge at " + address);
        }
        if (!up) {
            endpoint.stop();
            throw new MessageBusException("Could not connect to rosbridge at " + address, connectFailure);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        endpoint.stop();
    }

    @Override
    public void register(String topic, String type, MessageHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");

        synchronized (lock) {
            Subscription subscription = subscriptions.get(topic);
            if (subscription == null) {
                subscription = new Subscription(type, "subscribe:" + topic + ":" + ids.incrementAndGet());
                subscription.handlers.add(handler);
                subscriptions.put(topic, subscription);

                ObjectNode frame = MAPPER.createObjectNode()
                        .put("op", "subscribe")
                        .put("id", subscription.id)
                        .put("topic", topic)
                        .put("type", type);
                endpoint.send(write(frame));
                transportEvent(MonitorTransportEvent.Kind.SUBSCRIBED, topic);
                return;
            }
            if (!subscription.type.equals(type)) {
                throw new IllegalArgumentException("Topic " + topic + " is already subscribed as "
                        + subscription.type + ", not " + type);
            }
            subscription.handlers.add(handler);
        }
    }

    @Override
    public void unregister(String topic, String type, MessageHandler handler) {
        synchronized (lock) {
            Subscription subscription = subscriptions.get(topic);
            if (subscription == null || !subscription.type.equals(type)) {
                return;
            }
            if (!subscription.handlers.removeIf(h -> h == handler) || !subscription.handlers.isEmpty()) {
                return;
            }
            subscriptions.remove(topic);

            if (!closed && up) {
                ObjectNode frame = MAPPER.createObjectNode()
                        .put("op", "unsubscribe")
                        .put("id", subscription.id)
                        .put("topic", topic);
                endpoint.send(write(frame));
            }
            transportEvent(MonitorTransportEvent.Kind.UNSUBSCRIBED, topic);
        }
    }

    /**
     * Topics with at least one registered handler.
     */
    public List<String> subscribedTopics() {
        return List.copyOf(subscriptions.keySet());
    }

    // -------------------------------------------------------------------------
    // WebSocketEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
        transportEvent(MonitorTransportEvent.Kind.UP, "");
        settled.countDown();
    }

    @Override
    public void onTransportDown(Throwable cause) {
        boolean wasUp = up;
        up = false;
        transportEvent(MonitorTransportEvent.Kind.DOWN, cause == null ? "closed" : String.valueOf(cause.getMessage()));

        if (settled.getCount() > 0) {
            connectFailure = cause;
            settled.countDown();
        }
        else if (wasUp && !closed) {
            errorListener.accept(new MessageBusException("Connection to rosbridge at " + address + " lost", cause));
        }
    }

    @Override
    public void onText(String text) {
        JsonNode frame;
        try {
            frame = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            errorListener.accept(new MessageBusException("Malformed rosbridge frame: " + text, e));
            return;
        }

        String op = frame.path("op").asText("");
        switch (op) {
            case "publish":
                deliver(frame);
                break;
            case "status":
                sink.onError(new MonitorErrorEvent(wallClock.now(),
                        "rosbridge " + frame.path("level").asText("status") + ": " + frame.path("msg").asText(""),
                        null));
                break;
            default:
                break;
        }
    }

    private void deliver(JsonNode frame) {
        String topic = frame.path("topic").asText(null);
        Subscription subscription = topic == null ? null : subscriptions.get(topic);
        if (subscription == null) {
            return;
        }

        JsonNode body = frame.get("msg");
        if (body == null || !body.isObject()) {
            errorListener.accept(new MessageBusException("Publish on " + topic + " carries no message object"));
            return;
        }
        Map<String, Object> message = MAPPER.convertValue(body, MESSAGE_TYPE);

        for (MessageHandler handler : subscription.handlers) {
            try {
                handler.onMessage(message);
            } catch (RuntimeException e) {
                errorListener.accept(e);
            }
        }
    }

    private void reportUnhandled(Throwable error) {
        sink.onError(new MonitorErrorEvent(wallClock.now(), "Unhandled message bus error", error));
    }

    private void transportEvent(MonitorTransportEvent.Kind kind, String detail) {
        sink.onTransportEvent(new MonitorTransportEvent(wallClock.now(), address, kind, detail));
    }

    private static String write(ObjectNode frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize rosbridge frame", e);
        }
    }

    private static final class Subscription
    {
        final String type;
        final String id;
        final List<MessageHandler> handlers = new CopyOnWriteArrayList<>();

        Subscription(String type, String id) {
            this.type = type;
            this.id = id;
        }
    }
}
