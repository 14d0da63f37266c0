package com.questrail.hexrot.mock;

import com.questrail.hexrot.codec.FrameCodec;
import com.questrail.hexrot.codec.impl.CommandCodec;
import com.questrail.hexrot.codec.impl.CommandStatusCodec;
import com.questrail.hexrot.codec.impl.HeaderCodec;
import com.questrail.hexrot.config.MockControllerConfig;
import com.questrail.hexrot.internal.state.ControllerState;
import com.questrail.hexrot.internal.state.DeviceState;
import com.questrail.hexrot.internal.state.DeviceStateReducer;
import com.questrail.hexrot.internal.state.SetStateParam;
import com.questrail.hexrot.internal.time.Cancellable;
import com.questrail.hexrot.link.WrappingCounter;
import com.questrail.hexrot.model.Command;
import com.questrail.hexrot.model.CommandStatus;
import com.questrail.hexrot.model.Header;
import com.questrail.hexrot.observability.HexrotErrorEvent;
import com.questrail.hexrot.observability.HexrotStateTransitionEvent;
import com.questrail.hexrot.observability.HexrotTransportObservabilityEvent;
import com.questrail.hexrot.transport.SingleClientServerListener;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * BaseMockController
 * =============================================================================
 * Hardware-side emulator for a hexapod or rotator controller: accepts one
 * link connection, validates and applies its commands, and streams config and
 * telemetry back.
 *
 * <h2>Command dispatch</h2>
 * The command table is built once, at construction: SET_STATE handlers for
 * every {@link SetStateParam} (delegating to {@link DeviceStateReducer}) plus
 * whatever {@link #extraCommands()} adds. A command whose key is missing, or
 * whose handler throws {@link DeviceCommandException}, is answered NO_ACK and
 * leaves all state untouched.
 *
 * <h2>Per connection</h2>
 * <ol>
 *   <li>one config frame, and again whenever {@link #setConfig(Object)} is called</li>
 *   <li>a telemetry frame immediately and then every telemetry interval,
 *       after {@link #updateTelemetry(double)} has advanced the emulation</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * Every command, tick and state change runs on the runtime's executor, one at
 * a time. Subclass hooks may therefore use plain fields. The state and config
 * accessors are safe to read from any thread.
 *
 * @param <C> device config record
 * @param <T> device telemetry record
 */
public abstract class BaseMockController<C, T> implements AutoCloseable
{
    private final MockControllerConfig config;
    private final FrameCodec<C> configCodec;
    private final FrameCodec<T> telemetryCodec;
    private final MockControllerRuntime runtime;

    private final DeviceStateReducer reducer = new DeviceStateReducer();
    private final Map<CommandKey, CommandHandler> commandTable;
    private final Set<Integer> multiPurposeCodes;

    private final WrappingCounter configCounter = new WrappingCounter(32);
    private final WrappingCounter telemetryCounter = new WrappingCounter(32);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile DeviceState deviceState;
    private volatile C deviceConfig;

    // Confined to the executor.
    private long connectionGeneration;
    private boolean clientConnected;
    private Cancellable telemetryTask;
    private long lastTickNanos;

    /**
     * @param setStateCode command code the device uses for SET_STATE
     */
    protected BaseMockController(MockControllerConfig config,
                                 FrameCodec<C> configCodec,
                                 FrameCodec<T> telemetryCodec,
                                 C initialConfig,
                                 ControllerState initialState,
                                 int setStateCode,
                                 MockControllerRuntime runtime)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.configCodec = Objects.requireNonNull(configCodec, "configCodec");
        this.telemetryCodec = Objects.requireNonNull(telemetryCodec, "telemetryCodec");
        this.deviceConfig = Objects.requireNonNull(initialConfig, "initialConfig");
        this.deviceState = DeviceState.entering(Objects.requireNonNull(initialState, "initialState"));
        this.runtime = Objects.requireNonNull(runtime, "runtime");

        Map<CommandKey, CommandHandler> table = new HashMap<>();
        for (SetStateParam param : SetStateParam.values()) {
            table.put(CommandKey.of(setStateCode, param.wireValue()), command -> applySetState(param, command));
        }
        extraCommands().forEach((key, handler) -> {
            if (table.putIfAbsent(key, Objects.requireNonNull(handler, "handler")) != null) {
                throw new IllegalArgumentException("duplicate command key " + key);
            }
        });
        this.commandTable = Collections.unmodifiableMap(table);
        this.multiPurposeCodes = table.keySet().stream()
                .filter(CommandKey::isMultiPurpose)
                .map(CommandKey::code)
                .collect(Collectors.toUnmodifiableSet());

        runtime.server().setListener(new ServerListener());
    }

    // ---------------------------------------------------------------------
    // Subclass surface
    // ---------------------------------------------------------------------

    /**
     * Device-specific commands. Called once from the constructor, before
     * subclass fields are assigned, so handlers should be method references
     * that touch fields only when invoked.
     */
    protected abstract Map<CommandKey, CommandHandler> extraCommands();

    /**
     * Builds the telemetry record for the current emulated state.
     */
    protected abstract T telemetry();

    /**
     * Advances the emulation by {@code elapsedSeconds} before each telemetry frame.
     */
    protected void updateTelemetry(double elapsedSeconds) {
    }

    /**
     * Called after every applied state change, including simulated faults.
     */
    protected void onStateChanged(DeviceState previous, DeviceState current) {
    }

    /**
     * Rejects the command unless the controller is in one of {@code allowed}.
     */
    protected final void assertState(ControllerState... allowed) {
        ControllerState current = deviceState.state();
        if (Arrays.asList(allowed).contains(current)) {
            return;
        }
        String names = Arrays.stream(allowed).map(Enum::name).collect(Collectors.joining(" or "));
        throw new DeviceCommandException("state=" + current + "; must be " + names);
    }

    protected final void setDeviceState(DeviceState newState, Command trigger) {
        DeviceState previous = deviceState;
        if (previous.equals(newState)) {
            return;
        }
        deviceState = newState;
        runtime.observability().onStateTransition(
                new HexrotStateTransitionEvent(runtime.wallClock().now(), previous, newState, trigger));
        onStateChanged(previous, newState);
    }

    /**
     * Replaces the config and writes it to the connected link.
     */
    protected final void setConfig(C newConfig) {
        deviceConfig = Objects.requireNonNull(newConfig, "newConfig");
        writeConfig();
    }

    // ---------------------------------------------------------------------
    // Public surface
    // ---------------------------------------------------------------------

    /**
     * Binds the listening socket.
     */
    public void start() {
        runtime.server().start();
    }

    public int port() {
        return runtime.server().port();
    }

    public boolean isConnected() {
        return runtime.server().isConnected();
    }

    public DeviceState deviceState() {
        return deviceState;
    }

    public C config() {
        return deviceConfig;
    }

    /**
     * Forces the FAULT state, as a hardware fault would.
     */
    public void simulateFault() {
        runtime.executor().execute(() -> setDeviceState(DeviceState.entering(ControllerState.FAULT), null));
    }

    /**
     * Drops the current link connection; the controller keeps listening.
     */
    public void closeClient() {
        runtime.server().closeClient();
    }

    /**
     * Writes a command status frame with the given header counter. Normally
     * only called in reply to a command; tests use it to send unsolicited or
     * mismatched statuses.
     */
    public void writeCommandStatus(long counter, CommandStatus status) {
        Header header = Header.stamped(CommandStatusCodec.INSTANCE.frameId(), counter, runtime.wallClock().now());
        sendFrame(header, CommandStatusCodec.INSTANCE.encode(status), "command status " + counter);
    }

    /**
     * Stops the telemetry loop, drops any client, stops listening and shuts
     * down the runtime. Idempotent. Must not be called from the executor.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        runtime.executor().execute(this::stopTelemetryLoop);
        runtime.server().close();
        runtime.close();
    }

    // ---------------------------------------------------------------------
    // Command handling
    // ---------------------------------------------------------------------

    private void handleCommand(byte[] record) {
        Command command = CommandCodec.INSTANCE.decode(record);
        writeCommandStatus(command.counter(), dispatch(command));
    }

    private CommandStatus dispatch(Command command) {
        CommandKey key = multiPurposeCodes.contains(command.code())
                ? CommandKey.of(command.code(), (int) command.param1())
                : CommandKey.of(command.code());

        CommandHandler handler = commandTable.get(key);
        if (handler == null) {
            return CommandStatus.noAck(key.subCommand().isPresent()
                    ? "Unsupported command " + key.code() + "/" + key.subCommand().getAsInt()
                    : "Unsupported command " + key.code());
        }

        try {
            return CommandStatus.ack(handler.execute(command));
        }
        catch (DeviceCommandException e) {
            return CommandStatus.noAck(e.getMessage());
        }
        catch (RuntimeException e) {
            error("Handler for " + key + " failed on " + command, e);
            return CommandStatus.noAck("Failed: " + e);
        }
    }

    private double applySetState(SetStateParam param, Command command) {
        DeviceStateReducer.Result result = reducer.apply(deviceState, param);
        if (!result.isAccepted()) {
            throw new DeviceCommandException(result.rejectionReason());
        }
        setDeviceState(result.newState(), command);
        return 0.0;
    }

    // ---------------------------------------------------------------------
    // Connection and telemetry loop
    // ---------------------------------------------------------------------

    private void onClientConnected() {
        connectionGeneration++;
        clientConnected = true;
        transportEvent(HexrotTransportObservabilityEvent.Kind.CONNECTED);

        writeConfig();
        lastTickNanos = runtime.clock().nowNanos();
        tick(connectionGeneration);
    }

    private void onClientDisconnected() {
        connectionGeneration++;
        clientConnected = false;
        transportEvent(HexrotTransportObservabilityEvent.Kind.DISCONNECTED);
        stopTelemetryLoop();
    }

    private void tick(long generation) {
        if (closed.get() || !clientConnected || generation != connectionGeneration) {
            return;
        }

        long now = runtime.clock().nowNanos();
        updateTelemetry((now - lastTickNanos) / 1e9);
        lastTickNanos = now;

        Header header = Header.stamped(telemetryCodec.frameId(), telemetryCounter.next(), runtime.wallClock().now());
        sendFrame(header, telemetryCodec.encode(telemetry()), "telemetry");

        telemetryTask = runtime.scheduler().scheduleAfter(config.telemetryInterval(), runtime.clock(),
                () -> runtime.executor().execute(() -> tick(generation)));
    }

    private void stopTelemetryLoop() {
        Cancellable task = telemetryTask;
        telemetryTask = null;
        if (task != null) {
            task.cancel();
        }
    }

    private void writeConfig() {
        Header header = Header.stamped(configCodec.frameId(), configCounter.next(), runtime.wallClock().now());
        sendFrame(header, configCodec.encode(deviceConfig), "config");
    }

    private void sendFrame(Header header, byte[] payload, String what) {
        if (!runtime.server().isConnected()) {
            return;
        }
        runtime.server().send(HeaderCodec.INSTANCE.encode(header), payload).whenComplete((ignored, failure) -> {
            if (failure != null && runtime.server().isConnected()) {
                error("Failed to write " + what, failure);
            }
        });
    }

    private void transportEvent(HexrotTransportObservabilityEvent.Kind kind) {
        runtime.observability().onTransportEvent(new HexrotTransportObservabilityEvent(
                runtime.wallClock().now(), kind, "mock controller " + config.host() + ":" + config.port(), null));
    }

    private void error(String message, Throwable cause) {
        runtime.observability().onError(new HexrotErrorEvent(runtime.wallClock().now(), message, cause));
    }

    /**
     * ServerListener
     * -------------------------------------------------------------------------
     * Moves every transport callback onto the executor.
     */
    private final class ServerListener implements SingleClientServerListener
    {
        @Override
        public void onConnectionChange(boolean connected) {
            runtime.executor().execute(connected
                    ? BaseMockController.this::onClientConnected
                    : BaseMockController.this::onClientDisconnected);
        }

        @Override
        public void onRecord(byte[] record) {
            runtime.executor().execute(() -> handleCommand(record));
        }
    }
}
