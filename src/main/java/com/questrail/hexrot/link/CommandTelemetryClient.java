package com.questrail.hexrot.link;

import com.questrail.hexrot.codec.FrameCodec;
import com.questrail.hexrot.codec.WireFormatException;
import com.questrail.hexrot.codec.impl.CommandCodec;
import com.questrail.hexrot.codec.impl.CommandStatusCodec;
import com.questrail.hexrot.codec.impl.FrameCatalog;
import com.questrail.hexrot.codec.impl.HeaderCodec;
import com.questrail.hexrot.config.LinkConfig;
import com.questrail.hexrot.internal.time.SystemWallClock;
import com.questrail.hexrot.internal.time.WallClock;
import com.questrail.hexrot.model.Command;
import com.questrail.hexrot.model.CommandStatus;
import com.questrail.hexrot.model.Header;
import com.questrail.hexrot.observability.HexrotErrorEvent;
import com.questrail.hexrot.observability.HexrotObservabilitySink;
import com.questrail.hexrot.observability.HexrotProtocolObservabilityEvent;
import com.questrail.hexrot.observability.HexrotTransportObservabilityEvent;
import com.questrail.hexrot.observability.Slf4jHexrotObservabilitySink;
import com.questrail.hexrot.transport.StreamEndpoint;
import com.questrail.hexrot.transport.StreamEndpointListener;
import com.questrail.hexrot.transport.tcp.netty.NettyTcpClientEndpoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CommandTelemetryClient
 * =============================================================================
 * The command/telemetry link: one TCP connection to a hexapod or rotator
 * controller, carrying commands out and config, telemetry and command
 * statuses in.
 *
 * <h2>Type parameters</h2>
 * {@code C} and {@code T} are the device's config and telemetry records. The
 * codecs passed at construction fix their frame ids and sizes, which in turn
 * fix how the inbound stream is split.
 *
 * <h2>Commands</h2>
 * {@link #runCommand(Command)} is synchronous. Commands from all callers are
 * serialized by one fair lock, so at most one command is ever awaiting its
 * status. Each is stamped with the configured commander and the next value of
 * a 32-bit wrapping counter that starts at 0 for the connection. A status is
 * matched to the pending command by the counter in its header; any other
 * status is logged and discarded.
 *
 * <h2>Inbound frames</h2>
 * Frames are handled on the transport's I/O thread in wire order: config and
 * telemetry replace the cached snapshot, wake waiters and are passed to
 * {@link LinkListener}s. Listener failures are logged and never disturb the
 * reader. Records are immutable, so snapshots can be shared freely.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   NEW --connect()--> CONNECTING --up--> CONNECTED --drop--> DISCONNECTED
 *    \________________________\______________\______________\--close()--> CLOSED
 * </pre>
 * A link connects once. After a drop or a close, build a new link.
 *
 * @param <C> device config record
 * @param <T> device telemetry record
 */
public final class CommandTelemetryClient<C, T> implements AutoCloseable
{
    private enum Phase { NEW, CONNECTING, CONNECTED, DISCONNECTED, CLOSED }

    private record PendingCommand(long counter, CompletableFuture<CommandStatus> reply) {}

    private static final int COUNTER_BITS = 32;

    private final LinkConfig config;
    private final FrameCodec<C> configCodec;
    private final FrameCodec<T> telemetryCodec;
    private final StreamEndpoint endpoint;
    private final HexrotObservabilitySink observability;
    private final WallClock wallClock;

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.NEW);
    private volatile boolean shouldBeConnected;

    private final ReentrantLock commandLock = new ReentrantLock(true);
    private final WrappingCounter commandCounter = new WrappingCounter(COUNTER_BITS);
    private volatile PendingCommand pending;

    private volatile C lastConfig;
    private volatile T lastTelemetry;
    private final CompletableFuture<C> configured = new CompletableFuture<>();
    private final List<CompletableFuture<T>> telemetryWaiters = new ArrayList<>();

    private final List<LinkListener<C, T>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Production constructor: Netty TCP transport, SLF4J observability.
     */
    public CommandTelemetryClient(LinkConfig config, FrameCodec<C> configCodec, FrameCodec<T> telemetryCodec)
    {
        this(config, configCodec, telemetryCodec,
                new NettyTcpClientEndpoint(
                        config.remoteAddress(),
                        frameCatalog(configCodec, telemetryCodec),
                        config.timingPolicy().connectTimeout()),
                new Slf4jHexrotObservabilitySink(),
                SystemWallClock.INSTANCE);
    }

    public CommandTelemetryClient(LinkConfig config,
                                  FrameCodec<C> configCodec,
                                  FrameCodec<T> telemetryCodec,
                                  StreamEndpoint endpoint,
                                  HexrotObservabilitySink observability,
                                  WallClock wallClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.configCodec = Objects.requireNonNull(configCodec, "configCodec");
        this.telemetryCodec = Objects.requireNonNull(telemetryCodec, "telemetryCodec");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.observability = Objects.requireNonNull(observability, "observability");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        // Rejects codecs whose frame ids collide.
        frameCatalog(configCodec, telemetryCodec);

        endpoint.setListener(new EndpointListener());
    }

    /**
     * The frames a link for this device accepts: command status, config and telemetry.
     */
    public static FrameCatalog frameCatalog(FrameCodec<?> configCodec, FrameCodec<?> telemetryCodec)
    {
        return FrameCatalog.of(CommandStatusCodec.INSTANCE, configCodec, telemetryCodec);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connects to the controller, waiting at most the configured connect timeout.
     *
     * @throws IllegalStateException  if this link was already connected or closed
     * @throws LinkTransportException if the connection could not be made; the
     *                                link is closed afterwards
     */
    public void connect()
    {
        if (!phase.compareAndSet(Phase.NEW, Phase.CONNECTING)) {
            throw new IllegalStateException("connect() is only valid on a new link; link is " + phase.get());
        }

        Duration timeout = config.timingPolicy().connectTimeout();
        try {
            endpoint.start().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortConnect();
            throw new LinkTransportException("Interrupted while connecting to " + endpoint, e);
        }
        catch (ExecutionException e) {
            abortConnect();
            throw new LinkTransportException("Could not connect to " + endpoint, e.getCause());
        }
        catch (TimeoutException e) {
            abortConnect();
            throw new LinkTransportException(
                    "Timed out after " + timeout.toMillis() + " ms connecting to " + endpoint, e);
        }

        if (phase.get() != Phase.CONNECTED) {
            throw new LinkClosedException("Link closed while connecting to " + endpoint);
        }
    }

    private void abortConnect()
    {
        phase.set(Phase.CLOSED);
        endpoint.stop();
        failOutstanding(new LinkClosedException("Connect to " + endpoint + " failed"));
    }

    /**
     * Closes the connection and fails everything still waiting on it:
     * a pending command fails with {@link LinkClosedException}, as do
     * {@link #nextTelemetry()} waiters. Idempotent.
     */
    @Override
    public void close()
    {
        Phase previous = phase.getAndSet(Phase.CLOSED);
        if (previous == Phase.CLOSED) {
            return;
        }
        shouldBeConnected = false;

        endpoint.stop();
        failOutstanding(new LinkClosedException("Link to " + endpoint + " closed"));

        if (previous == Phase.CONNECTED) {
            transportEvent(HexrotTransportObservabilityEvent.Kind.DISCONNECTED, null);
            notifyConnectionChange(false);
        }
    }

    public boolean isConnected()
    {
        return phase.get() == Phase.CONNECTED && endpoint.isConnected();
    }

    /**
     * {@code true} from a successful {@link #connect()} until {@link #close()}.
     * A link that is not connected but should be has lost its connection
     * unexpectedly.
     */
    public boolean shouldBeConnected()
    {
        return shouldBeConnected;
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    /**
     * Sends a command and waits for its status.
     *
     * @param command the command; its commander and counter are replaced
     * @return the controller's estimated duration of the action, in seconds
     * @throws CommandRejectedException if the controller answered NO_ACK
     * @throws CommandTimeoutException  if no status arrived within the command timeout
     * @throws LinkTransportException   if the link is not connected (nothing is
     *                                  written) or the connection was lost while waiting
     * @throws LinkClosedException      if the link was closed while waiting
     */
    public double runCommand(Command command)
    {
        Objects.requireNonNull(command, "command");
        requireConnected();

        lockCommands();
        try {
            return execute(command);
        }
        finally {
            commandLock.unlock();
        }
    }

    /**
     * Runs several commands back to back while holding the command lock, so no
     * other caller's command can be interleaved. Stops at the first failure.
     *
     * @return the duration reported for each command, in order
     */
    public double[] runCommands(Command... commands)
    {
        Objects.requireNonNull(commands, "commands");
        requireConnected();

        lockCommands();
        try {
            double[] durations = new double[commands.length];
            for (int i = 0; i < commands.length; i++) {
                durations[i] = execute(Objects.requireNonNull(commands[i], "command"));
            }
            return durations;
        }
        finally {
            commandLock.unlock();
        }
    }

    private void lockCommands()
    {
        try {
            commandLock.lockInterruptibly();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LinkException("Interrupted while waiting for the command lock", e);
        }
    }

    // Caller holds commandLock.
    private double execute(Command command)
    {
        requireConnected();

        long counter = commandCounter.next();
        Command stamped = command.withCommander(config.commander()).withCounter(counter);
        PendingCommand p = new PendingCommand(counter, new CompletableFuture<>());
        pending = p;
        try {
            // Teardown only fails a command it can see; recheck once p is published.
            requireConnected();

            endpoint.send(CommandCodec.INSTANCE.encode(stamped)).whenComplete((ignored, error) -> {
                if (error != null) {
                    p.reply().completeExceptionally(
                            new LinkTransportException("Write of command " + counter + " failed", error));
                }
            });
            protocolEvent(HexrotProtocolObservabilityEvent.Kind.COMMAND_SENT, counter, stamped.toString());

            CommandStatus status = awaitStatus(p);
            if (!status.isAck()) {
                protocolEvent(HexrotProtocolObservabilityEvent.Kind.COMMAND_REJECTED, counter, status.reason());
                throw new CommandRejectedException(counter, status.reason());
            }
            protocolEvent(HexrotProtocolObservabilityEvent.Kind.COMMAND_ACKNOWLEDGED, counter,
                    "duration=" + status.duration());
            return status.duration();
        }
        finally {
            pending = null;
        }
    }

    private CommandStatus awaitStatus(PendingCommand p)
    {
        Duration timeout = config.timingPolicy().commandTimeout();
        try {
            return p.reply().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            protocolEvent(HexrotProtocolObservabilityEvent.Kind.COMMAND_TIMED_OUT, p.counter(),
                    "no status within " + timeout.toMillis() + " ms");
            throw new CommandTimeoutException(p.counter(), timeout);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LinkClosedException) {
                throw new LinkClosedException(
                        "Link closed while waiting for status of command " + p.counter());
            }
            throw new LinkTransportException(
                    "Connection lost while waiting for status of command " + p.counter(), cause);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LinkException("Interrupted while waiting for status of command " + p.counter(), e);
        }
    }

    private void requireConnected()
    {
        Phase current = phase.get();
        if (current == Phase.CLOSED) {
            throw new LinkClosedException("Link to " + endpoint + " is closed");
        }
        if (current != Phase.CONNECTED) {
            throw new LinkTransportException("Link to " + endpoint + " is not connected (" + current + ")");
        }
    }

    // ---------------------------------------------------------------------
    // Telemetry and config
    // ---------------------------------------------------------------------

    /**
     * Returns a future for the first telemetry frame received after this call.
     * It fails with a {@link LinkTransportException} if the connection ends
     * first, and fails immediately if the link is not connected.
     */
    public CompletableFuture<T> nextTelemetry()
    {
        CompletableFuture<T> next = new CompletableFuture<>();
        synchronized (telemetryWaiters) {
            Phase current = phase.get();
            if (current != Phase.CONNECTED) {
                return CompletableFuture.failedFuture(current == Phase.CLOSED
                        ? new LinkClosedException("Link to " + endpoint + " is closed")
                        : new LinkTransportException("Link to " + endpoint + " is not connected (" + current + ")"));
            }
            telemetryWaiters.add(next);
        }
        return next;
    }

    /**
     * Completes with the first config received on this connection. It fails
     * with the listener's exception if a config listener threw on that first
     * delivery, or with a {@link LinkTransportException} if the connection
     * ends before any config arrives.
     */
    public CompletableFuture<C> configured()
    {
        return configured.copy();
    }

    public Optional<C> config()
    {
        return Optional.ofNullable(lastConfig);
    }

    public Optional<T> telemetry()
    {
        return Optional.ofNullable(lastTelemetry);
    }

    public void addListener(LinkListener<C, T> listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LinkListener<C, T> listener)
    {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void failOutstanding(LinkException failure)
    {
        PendingCommand p = pending;
        if (p != null) {
            p.reply().completeExceptionally(failure);
        }

        List<CompletableFuture<T>> waiters;
        synchronized (telemetryWaiters) {
            waiters = new ArrayList<>(telemetryWaiters);
            telemetryWaiters.clear();
        }
        for (CompletableFuture<T> waiter : waiters) {
            waiter.completeExceptionally(failure);
        }

        configured.completeExceptionally(failure);
    }

    private void onCommandStatus(Header header, CommandStatus status)
    {
        PendingCommand p = pending;
        if (p == null || p.counter() != header.counter()) {
            protocolEvent(HexrotProtocolObservabilityEvent.Kind.COMMAND_STATUS_DISCARDED, header.counter(),
                    p == null ? "no command pending" : "pending command is " + p.counter());
            return;
        }
        p.reply().complete(status);
    }

    private void onConfig(Header header, C config)
    {
        lastConfig = config;
        protocolEvent(HexrotProtocolObservabilityEvent.Kind.CONFIG_RECEIVED, header.counter(), config.toString());

        boolean delivered = true;
        for (LinkListener<C, T> listener : listeners) {
            try {
                listener.onConfig(config);
            }
            catch (RuntimeException e) {
                error("Config listener " + listener + " failed", e);
                delivered = false;
            }
        }

        // Resolved by the first delivery every listener accepted.
        if (delivered) {
            configured.complete(config);
        }
    }

    private void onTelemetry(T telemetry)
    {
        lastTelemetry = telemetry;

        List<CompletableFuture<T>> waiters;
        synchronized (telemetryWaiters) {
            waiters = new ArrayList<>(telemetryWaiters);
            telemetryWaiters.clear();
        }
        for (CompletableFuture<T> waiter : waiters) {
            waiter.complete(telemetry);
        }

        for (LinkListener<C, T> listener : listeners) {
            try {
                listener.onTelemetry(telemetry);
            }
            catch (RuntimeException e) {
                error("Telemetry listener " + listener + " failed", e);
            }
        }
    }

    private void notifyConnectionChange(boolean connected)
    {
        for (LinkListener<C, T> listener : listeners) {
            try {
                listener.onConnectionChange(connected);
            }
            catch (RuntimeException e) {
                error("Connection listener " + listener + " failed", e);
            }
        }
    }

    private void protocolEvent(HexrotProtocolObservabilityEvent.Kind kind, long counter, String detail)
    {
        observability.onProtocolEvent(new HexrotProtocolObservabilityEvent(wallClock.now(), kind, counter, detail));
    }

    private void transportEvent(HexrotTransportObservabilityEvent.Kind kind, Throwable cause)
    {
        observability.onTransportEvent(
                new HexrotTransportObservabilityEvent(wallClock.now(), kind, endpoint.toString(), cause));
    }

    private void error(String message, Throwable cause)
    {
        observability.onError(new HexrotErrorEvent(wallClock.now(), message, cause));
    }

    /**
     * EndpointListener
     * -------------------------------------------------------------------------
     * Receives transport callbacks on the I/O thread and turns them into link
     * state changes.
     */
    private final class EndpointListener implements StreamEndpointListener
    {
        @Override
        public void onTransportUp()
        {
            if (!phase.compareAndSet(Phase.CONNECTING, Phase.CONNECTED)) {
                return;
            }
            shouldBeConnected = true;
            transportEvent(HexrotTransportObservabilityEvent.Kind.CONNECTED, null);
            notifyConnectionChange(true);
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            Phase previous = phase.getAndUpdate(p -> p == Phase.CLOSED ? p : Phase.DISCONNECTED);
            if (previous != Phase.CONNECTED) {
                return;
            }

            transportEvent(HexrotTransportObservabilityEvent.Kind.DISCONNECTED, cause);
            failOutstanding(new LinkTransportException("Connection to " + endpoint + " lost", cause));
            notifyConnectionChange(false);
            endpoint.stop();
        }

        @Override
        public void onFrame(byte[] headerBytes, byte[] payload)
        {
            Header header = HeaderCodec.INSTANCE.decode(headerBytes);
            int frameId = header.frameId();
            try {
                if (frameId == CommandStatusCodec.INSTANCE.frameId()) {
                    onCommandStatus(header, CommandStatusCodec.INSTANCE.decode(payload));
                }
                else if (frameId == configCodec.frameId()) {
                    onConfig(header, configCodec.decode(payload));
                }
                else if (frameId == telemetryCodec.frameId()) {
                    onTelemetry(telemetryCodec.decode(payload));
                }
            }
            catch (WireFormatException | IllegalArgumentException e) {
                error("Dropping undecodable frame with id " + frameId, e);
            }
        }

        @Override
        public void onUnrecognizedFrame(int frameId, int discardedBytes)
        {
            protocolEvent(HexrotProtocolObservabilityEvent.Kind.UNRECOGNIZED_FRAME, -1,
                    "frame id " + frameId + "; discarded " + discardedBytes + " bytes");
        }
    }
}
