package com.questrail.hexrot.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Threading</h2>
 * <p>Tasks run on the executor's threads. The mock controller hands in a
 * single-threaded executor so scheduled ticks and command handling never
 * overlap.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>The executor is not owned here; whoever created it shuts it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines already in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
