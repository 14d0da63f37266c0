package com.questrail.hexrot.transport.tcp.netty;

import com.questrail.hexrot.codec.impl.FrameCatalog;
import com.questrail.hexrot.transport.StreamEndpoint;
import com.questrail.hexrot.transport.StreamEndpointListener;
import com.questrail.hexrot.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.io.EOFException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpClientEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port: one outbound
 * TCP connection to a controller.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It splits the
 * stream into frames with {@link HeaderFramingDecoder} and forwards them. It
 * MUST NOT decode records, correlate commands or apply timeouts other than the
 * TCP connect timeout.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Frames reach the listener as {@code byte[]}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects; the listener sees {@code onTransportUp}
 *       before the returned future completes.</li>
 *   <li>Peer close, I/O failure or {@link #stop()} produce exactly one
 *       {@code onTransportDown}.</li>
 *   <li>{@link #stop()} shuts down the dedicated event loop; the endpoint
 *       cannot be restarted.</li>
 * </ul>
 */
public final class NettyTcpClientEndpoint implements StreamEndpoint
{
    private static final long CLOSE_WAIT_MILLIS = 2_000;

    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean up = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile Channel channel;
    private volatile Throwable downCause;

    public NettyTcpClientEndpoint(InetSocketAddress remoteAddress, FrameCatalog catalog, Duration connectTimeout)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("framing", new HeaderFramingDecoder(catalog));
                        p.addLast("inbound", new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public CompletableFuture<Void> start()
    {
        StreamEndpointListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException("endpoint already started"));
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        bootstrap.connect(remoteAddress).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                result.completeExceptionally(
                        new TransportException("connect to " + remoteAddress + " failed", future.cause()));
                return;
            }
            channel = future.channel();
            up.set(true);
            try {
                l.onTransportUp();
                result.complete(null);
            }
            catch (RuntimeException e) {
                future.channel().close();
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            // Blocking on the event loop would deadlock; callbacks may call stop().
            if (ch.eventLoop().inEventLoop()) {
                ch.close();
            }
            else {
                ch.close().awaitUninterruptibly(CLOSE_WAIT_MILLIS);
            }
        }

        group.shutdownGracefully(0, CLOSE_WAIT_MILLIS, TimeUnit.MILLISECONDS);
        notifyDown(null);
    }

    @Override
    public boolean isConnected()
    {
        Channel ch = channel;
        return up.get() && ch != null && ch.isActive();
    }

    @Override
    public CompletableFuture<Void> send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            return NettyFutures.notConnected("send to " + remoteAddress);
        }
        return NettyFutures.toCompletable(ch.writeAndFlush(Unpooled.wrappedBuffer(payload)), "send to " + remoteAddress);
    }

    @Override
    public String toString()
    {
        return "tcp://" + remoteAddress.getHostString() + ":" + remoteAddress.getPort();
    }

    private void notifyDown(Throwable cause)
    {
        if (!up.compareAndSet(true, false)) {
            return;
        }
        StreamEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Translates framing decoder output into listener calls.
     */
    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            StreamEndpointListener l = listener;
            if (l == null) {
                return;
            }

            if (msg instanceof HeaderFramingDecoder.Frame frame) {
                l.onFrame(frame.header(), frame.payload());
            }
            else if (msg instanceof HeaderFramingDecoder.UnrecognizedFrame unrecognized) {
                l.onUnrecognizedFrame(unrecognized.frameId(), unrecognized.discardedBytes());
            }
            else if (msg instanceof HeaderFramingDecoder.TruncatedStream truncated) {
                downCause = new EOFException("connection closed with "
                        + truncated.bufferedBytes() + " bytes of an incomplete frame buffered");
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(downCause);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (downCause == null) {
                downCause = cause;
            }
            ctx.close();
        }
    }
}
