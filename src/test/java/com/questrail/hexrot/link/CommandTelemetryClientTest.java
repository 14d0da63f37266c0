package com.questrail.hexrot.link;

import com.questrail.hexrot.codec.WireFormat;
import com.questrail.hexrot.codec.impl.CommandCodec;
import com.questrail.hexrot.codec.impl.CommandStatusCodec;
import com.questrail.hexrot.config.LinkConfig;
import com.questrail.hexrot.config.LinkTimingPolicy;
import com.questrail.hexrot.internal.state.ControllerState;
import com.questrail.hexrot.internal.state.DeviceState;
import com.questrail.hexrot.mock.simple.SimpleConfig;
import com.questrail.hexrot.mock.simple.SimpleConfigCodec;
import com.questrail.hexrot.mock.simple.SimpleDevice;
import com.questrail.hexrot.mock.simple.SimpleTelemetry;
import com.questrail.hexrot.mock.simple.SimpleTelemetryCodec;
import com.questrail.hexrot.model.Command;
import com.questrail.hexrot.model.CommandStatus;
import com.questrail.hexrot.model.FrameId;
import com.questrail.hexrot.model.Header;
import com.questrail.hexrot.observability.HexrotProtocolObservabilityEvent.Kind;
import com.questrail.hexrot.observability.NullObservabilitySink;
import com.questrail.hexrot.observability.RecordingObservabilitySink;
import com.questrail.hexrot.transport.FakeStreamEndpoint;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandTelemetryClientTest
 * -----------------------------------------------------------------------------
 * Link behavior against a fake stream endpoint: no sockets, no Netty.
 *
 * <p>The fake's send hook stands in for the controller, answering each
 * command as it is written.</p>
 */
final class CommandTelemetryClientTest
{
    private final FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ExecutorService callers = Executors.newFixedThreadPool(2);

    private CommandTelemetryClient<SimpleConfig, SimpleTelemetry> client = newClient(Duration.ofMillis(200));

    @AfterEach
    void tearDown()
    {
        client.close();
        callers.shutdownNow();
    }

    private CommandTelemetryClient<SimpleConfig, SimpleTelemetry> newClient(Duration commandTimeout)
    {
        LinkConfig config = LinkConfig.builder()
                .withPort(5000)
                .withTimingPolicy(LinkTimingPolicy.defaults()
                        .withCommandTimeout(commandTimeout)
                        .withConnectTimeout(Duration.ofMillis(200)))
                .build();
        return new CommandTelemetryClient<>(config, SimpleConfigCodec.INSTANCE, SimpleTelemetryCodec.INSTANCE,
                endpoint, sink, () -> Instant.EPOCH);
    }

    // ---------------------------------------------------------------------
    // Connect
    // ---------------------------------------------------------------------

    @Test
    void connectNotifiesListenersAndMarksLinkAsExpected()
    {
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        client.addListener(new LinkListener<>() {
            @Override
            public void onConnectionChange(boolean connected) {
                changes.add(connected);
            }
        });

        assertFalse(client.shouldBeConnected());
        client.connect();

        assertTrue(client.isConnected());
        assertTrue(client.shouldBeConnected());
        assertEquals(List.of(true), changes);
    }

    @Test
    void connectIsOnlyValidOnce()
    {
        client.connect();

        assertThrows(IllegalStateException.class, client::connect);
    }

    @Test
    void failedConnectClosesTheLink()
    {
        endpoint.scriptStart(CompletableFuture.failedFuture(new IOException("refused")));

        LinkTransportException e = assertThrows(LinkTransportException.class, client::connect);

        assertInstanceOf(IOException.class, e.getCause());
        assertTrue(endpoint.wasStopped());
        assertFalse(client.isConnected());
        assertFalse(client.shouldBeConnected());
        assertThrows(LinkClosedException.class, () -> client.runCommand(SimpleDevice.move(1)));
    }

    @Test
    void connectGivesUpAfterConnectTimeout()
    {
        endpoint.scriptStart(new CompletableFuture<>());

        assertThrows(LinkTransportException.class, client::connect);
        assertTrue(endpoint.wasStopped());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    @Test
    void commandsCarryCommanderAndCountersFromZero()
    {
        client.connect();
        answerEach(c -> CommandStatus.ack(1.5));

        assertEquals(1.5, client.runCommand(SimpleDevice.move(3)));
        client.runCommand(SimpleDevice.move(4));

        List<Command> sent = endpoint.sentCommands();
        assertEquals(2, sent.size());
        assertEquals(0, sent.get(0).counter());
        assertEquals(1, sent.get(1).counter());
        assertEquals(Command.DEFAULT_COMMANDER, sent.get(0).commander());
        assertEquals(3.0, sent.get(0).param1());
        assertEquals(CommandCodec.SIZE, endpoint.sent().get(0).length);
    }

    @Test
    void noAckRaisesRejectionWithReason()
    {
        client.connect();
        answerEach(c -> CommandStatus.noAck("state=OFFLINE; must be ENABLED"));

        CommandRejectedException e = assertThrows(CommandRejectedException.class,
                () -> client.runCommand(SimpleDevice.move(3)));

        assertEquals(0, e.counter());
        assertEquals("state=OFFLINE; must be ENABLED", e.reason());
        assertEquals(1, sink.getProtocolEvents(Kind.COMMAND_REJECTED).size());
    }

    @Test
    void statusForAnotherCounterIsDiscardedAndCommandTimesOut()
    {
        client.connect();
        endpoint.onSend(bytes -> {
            Command c = CommandCodec.INSTANCE.decode(bytes);
            injectStatus(c.counter() + 1, CommandStatus.ack(0));
        });

        CommandTimeoutException e = assertThrows(CommandTimeoutException.class,
                () -> client.runCommand(SimpleDevice.move(3)));

        assertEquals(0, e.counter());
        assertEquals(1, sink.getProtocolEvents(Kind.COMMAND_STATUS_DISCARDED).size());
        assertEquals(1, sink.getProtocolEvents(Kind.COMMAND_TIMED_OUT).size());
        assertTrue(client.isConnected(), "a timeout leaves the connection alone");
    }

    @Test
    void lateStatusIsDiscardedAndNextCommandStillWorks()
    {
        client.connect();
        assertThrows(CommandTimeoutException.class, () -> client.runCommand(SimpleDevice.move(3)));

        injectStatus(0, CommandStatus.ack(0));
        assertEquals(1, sink.getProtocolEvents(Kind.COMMAND_STATUS_DISCARDED).size());

        answerEach(c -> CommandStatus.ack(2.0));
        assertEquals(2.0, client.runCommand(SimpleDevice.move(4)));
        assertEquals(1, endpoint.sentCommands().get(1).counter());
    }

    @Test
    void commandBeforeConnectWritesNothing()
    {
        assertThrows(LinkTransportException.class, () -> client.runCommand(SimpleDevice.move(3)));
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void failedWriteFailsTheCommand()
    {
        client.connect();
        endpoint.failSends(new IOException("broken pipe"));

        LinkTransportException e = assertThrows(LinkTransportException.class,
                () -> client.runCommand(SimpleDevice.move(3)));
        assertFalse(e instanceof LinkClosedException);
    }

    @Test
    void runCommandsStopsAtFirstFailure()
    {
        client.connect();
        answerEach(c -> c.counter() == 1 ? CommandStatus.noAck("nope") : CommandStatus.ack(c.counter()));

        assertThrows(CommandRejectedException.class, () -> client.runCommands(
                SimpleDevice.move(1), SimpleDevice.move(2), SimpleDevice.move(3)));
        assertEquals(2, endpoint.sent().size());
    }

    @Test
    void runCommandsReturnsEachDuration()
    {
        client.connect();
        answerEach(c -> CommandStatus.ack(c.counter() + 0.5));

        double[] durations = client.runCommands(SimpleDevice.move(1), SimpleDevice.move(2));

        assertArrayEquals(new double[] { 0.5, 1.5 }, durations);
    }

    @Test
    void concurrentCallersAreSerialized() throws Exception
    {
        client.connect();

        ScheduledExecutorService controller = Executors.newSingleThreadScheduledExecutor();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        endpoint.onSend(bytes -> {
            Command c = CommandCodec.INSTANCE.decode(bytes);
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            controller.schedule(() -> {
                inFlight.decrementAndGet();
                injectStatus(c.counter(), CommandStatus.ack(0));
            }, 5, TimeUnit.MILLISECONDS);
        });

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 2; t++) {
                futures.add(callers.submit(() -> {
                    for (int i = 0; i < 5; i++) {
                        client.runCommand(SimpleDevice.move(i));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        }
        finally {
            controller.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
        assertEquals(10, endpoint.sentCommands().stream().mapToLong(Command::counter).distinct().count());
    }

    // ---------------------------------------------------------------------
    // Teardown
    // ---------------------------------------------------------------------

    @Test
    void closeFailsPendingCommand() throws Exception
    {
        client = newClient(Duration.ofSeconds(5));
        client.connect();

        Future<Double> result = callers.submit(() -> client.runCommand(SimpleDevice.move(3)));
        awaitTrue(() -> endpoint.sent().size() == 1);

        client.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(LinkClosedException.class, e.getCause());
        assertFalse(client.shouldBeConnected());
    }

    @Test
    void dropFailsPendingCommandAndKeepsShouldBeConnected() throws Exception
    {
        client = newClient(Duration.ofSeconds(5));
        List<Boolean> changes = new CopyOnWriteArrayList<>();
        client.addListener(new LinkListener<>() {
            @Override
            public void onConnectionChange(boolean connected) {
                changes.add(connected);
            }
        });
        client.connect();

        Future<Double> result = callers.submit(() -> client.runCommand(SimpleDevice.move(3)));
        awaitTrue(() -> endpoint.sent().size() == 1);

        endpoint.dropConnection(new IOException("reset"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
        assertInstanceOf(LinkTransportException.class, e.getCause());
        assertFalse(e.getCause() instanceof LinkClosedException);

        assertFalse(client.isConnected());
        assertTrue(client.shouldBeConnected(), "an unexpected drop is visible");
        assertTrue(endpoint.wasStopped());
        assertEquals(List.of(true, false), changes);
        assertThrows(IllegalStateException.class, client::connect);
    }

    @Test
    void closeIsIdempotentAndNotifiesOnce()
    {
        AtomicInteger downs = new AtomicInteger();
        client.addListener(new LinkListener<>() {
            @Override
            public void onConnectionChange(boolean connected) {
                if (!connected) {
                    downs.incrementAndGet();
                }
            }
        });
        client.connect();

        client.close();
        client.close();

        assertEquals(1, downs.get());
        assertFalse(client.isConnected());
    }

    // ---------------------------------------------------------------------
    // Config and telemetry
    // ---------------------------------------------------------------------

    @Test
    void configIsCachedAndResolvesConfigured() throws Exception
    {
        client.connect();
        CompletableFuture<SimpleConfig> configured = client.configured();
        assertFalse(configured.isDone());

        injectConfig(SimpleConfig.DEFAULT);

        assertEquals(SimpleConfig.DEFAULT, configured.get(1, TimeUnit.SECONDS));
        assertEquals(SimpleConfig.DEFAULT, client.config().orElseThrow());
        assertEquals(1, sink.getProtocolEvents(Kind.CONFIG_RECEIVED).size());
    }

    @Test
    void failedConfigDeliveryLeavesConfiguredPendingUntilOneSucceeds() throws Exception
    {
        AtomicInteger calls = new AtomicInteger();
        client.addListener(new LinkListener<>() {
            @Override
            public void onConfig(SimpleConfig config) {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("transient");
                }
            }
        });
        client.connect();

        injectConfig(SimpleConfig.DEFAULT);

        assertFalse(client.configured().isDone());
        assertEquals(SimpleConfig.DEFAULT, client.config().orElseThrow());
        assertEquals(1, sink.getErrors().size());

        SimpleConfig slower = SimpleConfig.DEFAULT.withMaxVelocity(10);
        injectConfig(slower);

        assertEquals(2, calls.get());
        assertEquals(slower, client.configured().get(1, TimeUnit.SECONDS));
    }

    @Test
    void nextTelemetryResolvesWithFollowingFrame() throws Exception
    {
        client.connect();
        injectTelemetry(telemetryAt(1.0));

        CompletableFuture<SimpleTelemetry> next = client.nextTelemetry();
        assertFalse(next.isDone());

        injectTelemetry(telemetryAt(2.0));

        assertEquals(2.0, next.get(1, TimeUnit.SECONDS).currentPosition());
        assertEquals(2.0, client.telemetry().orElseThrow().currentPosition());
    }

    @Test
    void telemetryListenerFailureDoesNotStopOtherListeners()
    {
        List<SimpleTelemetry> seen = new CopyOnWriteArrayList<>();
        client.addListener(new LinkListener<>() {
            @Override
            public void onTelemetry(SimpleTelemetry telemetry) {
                throw new IllegalStateException("boom");
            }
        });
        client.addListener(new LinkListener<>() {
            @Override
            public void onTelemetry(SimpleTelemetry telemetry) {
                seen.add(telemetry);
            }
        });
        client.connect();

        injectTelemetry(telemetryAt(1.0));

        assertEquals(1, seen.size());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void removedListenerIsNotCalled()
    {
        List<SimpleTelemetry> seen = new CopyOnWriteArrayList<>();
        LinkListener<SimpleConfig, SimpleTelemetry> listener = new LinkListener<>() {
            @Override
            public void onTelemetry(SimpleTelemetry telemetry) {
                seen.add(telemetry);
            }
        };
        client.addListener(listener);
        client.connect();

        client.removeListener(listener);
        injectTelemetry(telemetryAt(1.0));

        assertTrue(seen.isEmpty());
    }

    @Test
    void telemetryWaitersFailOnCloseAndAfterIt()
    {
        client.connect();
        CompletableFuture<SimpleTelemetry> waiting = client.nextTelemetry();

        client.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(1, TimeUnit.SECONDS));
        assertInstanceOf(LinkClosedException.class, e.getCause());
        assertTrue(client.nextTelemetry().isCompletedExceptionally());
    }

    @Test
    void nextTelemetryBeforeConnectFailsImmediately()
    {
        CompletableFuture<SimpleTelemetry> next = client.nextTelemetry();

        ExecutionException e = assertThrows(ExecutionException.class, next::get);
        assertInstanceOf(LinkTransportException.class, e.getCause());
    }

    // ---------------------------------------------------------------------
    // Bad input
    // ---------------------------------------------------------------------

    @Test
    void unrecognizedFrameIsReported()
    {
        client.connect();

        endpoint.injectUnrecognizedFrame(0x42, 62);

        assertEquals(1, sink.getProtocolEvents(Kind.UNRECOGNIZED_FRAME).size());
        assertTrue(client.isConnected());
    }

    @Test
    void undecodableStatusIsDroppedWithError()
    {
        client.connect();
        ByteBuffer payload = WireFormat.allocate(CommandStatusCodec.SIZE);
        payload.putInt(77);

        endpoint.injectFrame(new Header(FrameId.COMMAND_STATUS.wireValue(), 0, 0, 0), payload.array());

        assertEquals(1, sink.getErrors().size());
        assertTrue(client.isConnected());
    }

    @Test
    void codecsWithCollidingFrameIdsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new CommandTelemetryClient<>(
                LinkConfig.builder().withPort(5000).build(),
                SimpleConfigCodec.INSTANCE, SimpleConfigCodec.INSTANCE,
                new FakeStreamEndpoint(), NullObservabilitySink.INSTANCE, () -> Instant.EPOCH));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void answerEach(Function<Command, CommandStatus> controller)
    {
        endpoint.onSend(bytes -> {
            Command c = CommandCodec.INSTANCE.decode(bytes);
            injectStatus(c.counter(), controller.apply(c));
        });
    }

    private void injectStatus(long counter, CommandStatus status)
    {
        endpoint.injectFrame(new Header(FrameId.COMMAND_STATUS.wireValue(), counter, 0, 0),
                CommandStatusCodec.INSTANCE.encode(status));
    }

    private void injectConfig(SimpleConfig config)
    {
        endpoint.injectFrame(new Header(FrameId.CONFIG.wireValue(), 0, 0, 0),
                SimpleConfigCodec.INSTANCE.encode(config));
    }

    private void injectTelemetry(SimpleTelemetry telemetry)
    {
        endpoint.injectFrame(new Header(FrameId.TELEMETRY.wireValue(), 0, 0, 0),
                SimpleTelemetryCodec.INSTANCE.encode(telemetry));
    }

    private static SimpleTelemetry telemetryAt(double position)
    {
        return SimpleTelemetry.of(DeviceState.entering(ControllerState.ENABLED), position, position);
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 2 s");
            }
            Thread.sleep(5);
        }
    }
}
