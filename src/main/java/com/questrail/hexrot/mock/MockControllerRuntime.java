package com.questrail.hexrot.mock;

import com.questrail.hexrot.codec.impl.CommandCodec;
import com.questrail.hexrot.config.MockControllerConfig;
import com.questrail.hexrot.internal.time.MonotonicClock;
import com.questrail.hexrot.internal.time.MonotonicScheduler;
import com.questrail.hexrot.internal.time.ScheduledExecutorScheduler;
import com.questrail.hexrot.internal.time.SystemMonotonicClock;
import com.questrail.hexrot.internal.time.SystemWallClock;
import com.questrail.hexrot.internal.time.WallClock;
import com.questrail.hexrot.observability.HexrotObservabilitySink;
import com.questrail.hexrot.observability.Slf4jHexrotObservabilitySink;
import com.questrail.hexrot.transport.SingleClientServer;
import com.questrail.hexrot.transport.tcp.netty.NettySingleClientServer;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * MockControllerRuntime
 * =============================================================================
 * Composition root for a mock controller: the listening transport, the single
 * thread all device state is confined to, and the clocks and scheduler that
 * pace telemetry.
 *
 * <p>The default build is a Netty server on the configured address and one
 * scheduled executor thread serving both as the confinement executor and the
 * scheduler. Tests substitute a fake server, an inline executor and a
 * deterministic scheduler.</p>
 */
public final class MockControllerRuntime implements AutoCloseable
{
    private final SingleClientServer server;
    private final Executor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final HexrotObservabilitySink observability;
    private final ScheduledExecutorService ownedExecutor;

    private MockControllerRuntime(Builder b, ScheduledExecutorService ownedExecutor)
    {
        this.server = b.server;
        this.executor = b.executor;
        this.scheduler = b.scheduler;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.observability = b.observability;
        this.ownedExecutor = ownedExecutor;
    }

    public SingleClientServer server() {
        return server;
    }

    public Executor executor() {
        return executor;
    }

    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    public MonotonicClock clock() {
        return clock;
    }

    public WallClock wallClock() {
        return wallClock;
    }

    public HexrotObservabilitySink observability() {
        return observability;
    }

    /**
     * Shuts down the executor this runtime created, if any. Must not be called
     * from that executor's thread.
     */
    @Override
    public void close()
    {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder(MockControllerConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final MockControllerConfig config;
        private SingleClientServer server;
        private Executor executor;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private HexrotObservabilitySink observability = new Slf4jHexrotObservabilitySink();

        private Builder(MockControllerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder withServer(SingleClientServer server) {
            this.server = server;
            return this;
        }

        /**
         * Executor and scheduler must be supplied together; tasks from both
         * must never run concurrently.
         */
        public Builder withExecution(Executor executor, MonotonicScheduler scheduler) {
            this.executor = executor;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(HexrotObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public MockControllerRuntime build() {
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observability, "observability");

            if (server == null) {
                server = new NettySingleClientServer(
                        new InetSocketAddress(config.host(), config.port()), CommandCodec.SIZE);
            }

            ScheduledExecutorService owned = null;
            if (executor == null && scheduler == null) {
                owned = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "mock-controller");
                    t.setDaemon(true);
                    return t;
                });
                executor = owned;
                scheduler = new ScheduledExecutorScheduler(owned, clock);
            }
            else if (executor == null || scheduler == null) {
                throw new IllegalStateException("executor and scheduler must be supplied together");
            }

            return new MockControllerRuntime(this, owned);
        }
    }
}
