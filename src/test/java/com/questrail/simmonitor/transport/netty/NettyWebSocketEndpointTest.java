package com.questrail.simmonitor.transport.netty;

import com.questrail.simmonitor.bus.rosbridge.RosbridgeMessageBus;
import com.questrail.simmonitor.observability.NullObservabilitySink;
import com.questrail.simmonitor.transport.WebSocketEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyWebSocketEndpointTest
 * -----------------------------------------------------------------------------
 * Runs the endpoint against an in-process WebSocket server on the loopback
 * interface.
 *
 * Note: uses real sockets and real time. Timeouts are generous.
 */
class NettyWebSocketEndpointTest {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Test
    void rosbridgeSubscriptionAndPublishTravelOverARealSocket() throws Exception {
        try (WebSocketTestServer server = new WebSocketTestServer()) {
            NettyWebSocketEndpoint endpoint = new NettyWebSocketEndpoint(server.uri(), CONNECT_TIMEOUT);
            RosbridgeMessageBus bus = new RosbridgeMessageBus(endpoint, server.uri().toString(),
                    CONNECT_TIMEOUT, NullObservabilitySink.INSTANCE);
            AtomicReference<Map<String, Object>> delivered = new AtomicReference<>();
            CountDownLatch received = new CountDownLatch(1);

            try {
                bus.open();
                bus.register("/goal", "std_msgs/Bool", message -> {
                    delivered.set(message);
                    received.countDown();
                });

                String subscribe = server.received.poll(5, TimeUnit.SECONDS);
                assertNotNull(subscribe, "server should see the subscription");
                assertTrue(subscribe.contains("\"op\":\"subscribe\""));
                assertTrue(subscribe.contains("\"topic\":\"/goal\""));

                server.push("{\"op\":\"publish\",\"topic\":\"/goal\",\"msg\":{\"data\":true}}");

                assertTrue(received.await(5, TimeUnit.SECONDS), "publish should be delivered");
                assertEquals(Boolean.TRUE, delivered.get().get("data"));
            } finally {
                bus.close();
            }
        }
    }

    @Test
    void listenerHearsUpThenDownOnceWhenStopped() throws Exception {
        try (WebSocketTestServer server = new WebSocketTestServer()) {
            NettyWebSocketEndpoint endpoint = new NettyWebSocketEndpoint(server.uri(), CONNECT_TIMEOUT);
            RecordingListener listener = new RecordingListener();
            endpoint.setListener(listener);

            endpoint.start();
            assertTrue(listener.up.await(5, TimeUnit.SECONDS));

            endpoint.stop();
            endpoint.stop();

            assertTrue(listener.down.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertEquals(1, listener.downCount.get());
        }
    }

    @Test
    void refusedConnectionIsReportedAsDownWithACause() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        NettyWebSocketEndpoint endpoint = new NettyWebSocketEndpoint(
                URI.create("ws://127.0.0.1:" + port), CONNECT_TIMEOUT);
        RecordingListener listener = new RecordingListener();
        endpoint.setListener(listener);

        try {
            endpoint.start();

            assertTrue(listener.down.await(5, TimeUnit.SECONDS));
            assertNotNull(listener.cause.get());
            assertEquals(1, listener.up.getCount(), "never up");
        } finally {
            endpoint.stop();
        }
    }

    @Test
    void sendingBeforeTheHandshakeIsRejected() {
        NettyWebSocketEndpoint endpoint = new NettyWebSocketEndpoint(URI.create("ws://127.0.0.1:9"), CONNECT_TIMEOUT);
        endpoint.setListener(new RecordingListener());
        try {
            assertThrows(IllegalStateException.class, () -> endpoint.send("{}"));
        } finally {
            endpoint.stop();
        }
    }

    @Test
    void startWithoutAListenerIsRejected() {
        NettyWebSocketEndpoint endpoint = new NettyWebSocketEndpoint(URI.create("ws://127.0.0.1:9"), CONNECT_TIMEOUT);
        try {
            assertThrows(IllegalStateException.class, endpoint::start);
        } finally {
            endpoint.stop();
        }
    }

    private static final class RecordingListener implements WebSocketEndpointListener {
        final CountDownLatch up = new CountDownLatch(1);
        final CountDownLatch down = new CountDownLatch(1);
        final AtomicInteger downCount = new AtomicInteger();
        final AtomicReference<Throwable> cause = new AtomicReference<>();
        final BlockingQueue<String> texts = new LinkedBlockingQueue<>();

        @Override
        public void onTransportUp() {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            this.cause.set(cause);
            downCount.incrementAndGet();
            down.countDown();
        }

        @Override
        public void onText(String text) {
            texts.add(text);
        }
    }

    /**
     * Minimal WebSocket server: records inbound text frames and pushes frames
     * to the most recent client.
     */
    private static final class WebSocketTestServer implements AutoCloseable {
        final BlockingQueue<String> received = new LinkedBlockingQueue<>();
        private final NioEventLoopGroup group = new NioEventLoopGroup(1);
        private final Channel serverChannel;
        private volatile Channel client;

        WebSocketTestServer() throws InterruptedException {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(group)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new HttpServerCodec());
                            ch.pipeline().addLast(new HttpObjectAggregator(65536));
                            ch.pipeline().addLast(new WebSocketServerProtocolHandler("/"));
                            ch.pipeline().addLast(new SimpleChannelInboundHandler<TextWebSocketFrame>() {
                                @Override
                                protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
                                    client = ctx.channel();
                                    received.add(frame.text());
                                }

                                @Override
                                public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
                                    if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                                        client = ctx.channel();
                                    }
                                    super.userEventTriggered(ctx, evt);
                                }
                            });
                        }
                    });
            this.serverChannel = bootstrap.bind("127.0.0.1", 0).sync().channel();
        }

        URI uri() {
            int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
            return URI.create("ws://127.0.0.1:" + port + "/");
        }

        void push(String text) {
            client.writeAndFlush(new TextWebSocketFrame(text));
        }

        @Override
        public void close() {
            serverChannel.close().syncUninterruptibly();
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }
}
