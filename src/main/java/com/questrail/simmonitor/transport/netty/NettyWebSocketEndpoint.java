package com.questrail.simmonitor.transport.netty;

import com.questrail.simmonitor.transport.WebSocketEndpoint;
import com.questrail.simmonitor.transport.WebSocketEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link WebSocketEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * A pure transport adapter: it connects, completes the WebSocket handshake and
 * moves text frames. It does not parse the JSON the frames carry.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, frames) do not escape
 * this package. Fragmented messages are reassembled before delivery.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects; the listener hears {@code onTransportUp}
 *       once the handshake completes.</li>
 *   <li>{@code onTransportDown} is delivered at most once, whether the
 *       connection fails, drops, or is closed by {@link #stop()}.</li>
 * </ul>
 */
public final class NettyWebSocketEndpoint implements WebSocketEndpoint
{
    private static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final URI uri;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean down = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile WebSocketEndpointListener listener;
    private volatile Channel channel;
    private volatile boolean up;

    public NettyWebSocketEndpoint(URI uri, Duration connectTimeout)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("WebSocket URI has no host: " + uri);
        }

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_BYTES);

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketClientProtocolHandler(handshaker));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(WebSocketEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();

        int port = uri.getPort() != -1 ? uri.getPort() : 80;
        ChannelFuture f = bootstrap.connect(uri.getHost(), port);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
            }
            else {
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();

        notifyDown(null);
    }

    @Override
    public void send(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        if (ch == null || !up) {
            throw new IllegalStateException("WebSocket to " + uri + " is not open");
        }
        ch.writeAndFlush(new TextWebSocketFrame(text));
    }

    private WebSocketEndpointListener requireListener()
    {
        WebSocketEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("WebSocketEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyDown(Throwable cause)
    {
        up = false;
        WebSocketEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards handshake completion and reassembled text frames to the port
     * listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<TextWebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                channel = ctx.channel();
                up = true;
                WebSocketEndpointListener l = listener;
                if (l != null) {
                    l.onTransportUp();
                }
            }
            else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                notifyDown(new WebSocketHandshakeException("WebSocket handshake with " + uri + " timed out"));
                ctx.close();
            }
            else {
                super.userEventTriggered(ctx, evt);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame)
        {
            WebSocketEndpointListener l = listener;
            if (l != null) {
                l.onText(frame.text());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
