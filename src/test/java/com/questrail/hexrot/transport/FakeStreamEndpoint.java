package com.questrail.hexrot.transport;

import com.questrail.hexrot.codec.impl.CommandCodec;
import com.questrail.hexrot.codec.impl.HeaderCodec;
import com.questrail.hexrot.model.Command;
import com.questrail.hexrot.model.Header;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>It knows nothing about commands or statuses; it only stores outbound
 * bytes and lets tests inject inbound frames. An optional send hook lets a
 * test play the controller and answer each command as it is written.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    private volatile StreamEndpointListener listener;
    private final List<byte[]> sent = new CopyOnWriteArrayList<>();

    private volatile boolean up;
    private volatile boolean stopped;
    private volatile CompletableFuture<Void> startResult;
    private volatile Throwable sendFailure;
    private volatile Consumer<byte[]> onSend = bytes -> {};

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> scripted = startResult;
        if (scripted != null) {
            return scripted;
        }
        if (!up) {
            up = true;
            listener.onTransportUp();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void stop() {
        stopped = true;
        if (up) {
            up = false;
            listener.onTransportDown(null);
        }
    }

    @Override
    public boolean isConnected() {
        return up;
    }

    @Override
    public CompletableFuture<Void> send(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        Throwable failure = sendFailure;
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        sent.add(payload);
        onSend.accept(payload);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String toString() {
        return "fake://endpoint";
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Makes {@link #start()} return this future instead of connecting. */
    public void scriptStart(CompletableFuture<Void> result) {
        this.startResult = result;
    }

    public void failSends(Throwable failure) {
        this.sendFailure = failure;
    }

    /** Called with every written command, on the writing thread. */
    public void onSend(Consumer<byte[]> hook) {
        this.onSend = Objects.requireNonNull(hook, "hook");
    }

    public void injectFrame(Header header, byte[] payload) {
        listener.onFrame(HeaderCodec.INSTANCE.encode(header), payload);
    }

    public void injectUnrecognizedFrame(int frameId, int discardedBytes) {
        listener.onUnrecognizedFrame(frameId, discardedBytes);
    }

    /** Simulates the peer going away. */
    public void dropConnection(Throwable cause) {
        if (up) {
            up = false;
            listener.onTransportDown(cause);
        }
    }

    public boolean wasStopped() {
        return stopped;
    }

    public List<byte[]> sent() {
        return List.copyOf(sent);
    }

    public List<Command> sentCommands() {
        return sent.stream().map(CommandCodec.INSTANCE::decode).collect(Collectors.toList());
    }
}
