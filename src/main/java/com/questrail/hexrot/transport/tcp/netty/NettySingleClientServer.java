package com.questrail.hexrot.transport.tcp.netty;

import com.questrail.hexrot.transport.SingleClientServer;
import com.questrail.hexrot.transport.SingleClientServerListener;
import com.questrail.hexrot.transport.TransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.FixedLengthFrameDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettySingleClientServer
 * =============================================================================
 * Netty-backed implementation of the {@link SingleClientServer} port.
 *
 * <h2>Architectural Role</h2>
 * A pure transport adapter: it accepts connections, enforces the one-peer
 * rule, cuts inbound bytes into fixed-size records and writes outbound bytes.
 * It knows nothing about what the records mean.
 *
 * <h2>One peer</h2>
 * Adoption, release and transition notification happen under one lock, so
 * {@code onConnectionChange} is never fired twice for the same state and
 * notifications cannot be reordered.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package; records are copied to {@code byte[]}.
 */
public final class NettySingleClientServer implements SingleClientServer
{
    private static final Logger log = LoggerFactory.getLogger(NettySingleClientServer.class);

    private static final long CLOSE_WAIT_MILLIS = 2_000;

    private final InetSocketAddress bindAddress;
    private final int inboundRecordSize;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private final Object lock = new Object();

    // Guarded by lock.
    private Channel peer;
    private boolean lastConnected;
    private boolean started;
    private boolean closed;

    private volatile Channel serverChannel;
    private volatile SingleClientServerListener listener;

    /**
     * @param bindAddress       local address; port 0 binds an ephemeral port
     * @param inboundRecordSize size of each record the peer sends
     */
    public NettySingleClientServer(InetSocketAddress bindAddress, int inboundRecordSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (inboundRecordSize <= 0) {
            throw new IllegalArgumentException("inboundRecordSize must be positive");
        }
        this.inboundRecordSize = inboundRecordSize;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 4)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("records", new FixedLengthFrameDecoder(inboundRecordSize));
                        p.addLast("peer", new PeerHandler());
                    }
                });
    }

    @Override
    public void setListener(SingleClientServerListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        if (listener == null) {
            throw new IllegalStateException("SingleClientServerListener must be set before start()");
        }
        synchronized (lock) {
            if (started || closed) {
                throw new IllegalStateException("server already started or closed");
            }
            started = true;
        }

        ChannelFuture bind = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            shutdownGroups();
            throw new TransportException("bind to " + bindAddress + " failed", bind.cause());
        }
        serverChannel = bind.channel();
        log.info("Listening on {}", serverChannel.localAddress());
    }

    @Override
    public int port()
    {
        Channel sc = serverChannel;
        if (sc == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) sc.localAddress()).getPort();
    }

    @Override
    public boolean isConnected()
    {
        synchronized (lock) {
            return peer != null && peer.isActive();
        }
    }

    @Override
    public CompletableFuture<Void> send(byte[]... parts)
    {
        Objects.requireNonNull(parts, "parts");

        Channel ch;
        synchronized (lock) {
            ch = peer;
        }
        if (ch == null || !ch.isActive()) {
            return NettyFutures.notConnected("send");
        }
        return NettyFutures.toCompletable(ch.writeAndFlush(Unpooled.wrappedBuffer(parts)), "send");
    }

    @Override
    public void closeClient()
    {
        Channel ch;
        synchronized (lock) {
            ch = peer;
            peer = null;
            notifyTransition();
        }
        if (ch != null) {
            awaitClose(ch);
        }
    }

    @Override
    public void close()
    {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        closeClient();

        Channel sc = serverChannel;
        if (sc != null) {
            awaitClose(sc);
        }
        shutdownGroups();
    }

    boolean adopt(Channel ch)
    {
        synchronized (lock) {
            if (closed || (peer != null && peer.isActive())) {
                return false;
            }
            if (peer != null) {
                // Closed but its channelInactive has not run yet.
                release(peer);
            }
            peer = ch;
            notifyTransition();
            return true;
        }
    }

    void release(Channel ch)
    {
        synchronized (lock) {
            if (peer != ch) {
                return;
            }
            peer = null;
            notifyTransition();
        }
    }

    // Caller holds lock.
    private void notifyTransition()
    {
        boolean connected = peer != null;
        if (connected == lastConnected) {
            return;
        }
        lastConnected = connected;

        try {
            listener.onConnectionChange(connected);
        }
        catch (RuntimeException e) {
            log.error("Connection listener failed on transition to connected={}", connected, e);
        }
    }

    private static void awaitClose(Channel ch)
    {
        if (ch.eventLoop().inEventLoop()) {
            ch.close();
        }
        else {
            ch.close().awaitUninterruptibly(CLOSE_WAIT_MILLIS);
        }
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, CLOSE_WAIT_MILLIS, TimeUnit.MILLISECONDS);
        workerGroup.shutdownGracefully(0, CLOSE_WAIT_MILLIS, TimeUnit.MILLISECONDS);
    }

    /**
     * PeerHandler
     * -------------------------------------------------------------------------
     * One instance per accepted connection. Rejected connections are closed
     * from {@code channelActive} and never reach the listener.
     */
    private final class PeerHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            if (!adopt(ctx.channel())) {
                log.error("Rejecting connection from {}: a client is already connected",
                        ctx.channel().remoteAddress());
                ctx.close();
                return;
            }
            log.info("Client connected from {}", ctx.channel().remoteAddress());
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf record)
        {
            synchronized (lock) {
                if (peer != ctx.channel()) {
                    return;
                }
            }
            byte[] bytes = ByteBufUtil.getBytes(record);
            try {
                listener.onRecord(bytes);
            }
            catch (RuntimeException e) {
                log.error("Record listener failed", e);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            release(ctx.channel());
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Closing client connection {} after error", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
