package com.questrail.hexrot.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deadline scheduler expressed in {@link MonotonicClock} ticks.
 *
 * <p>Periodic work (the mock controller's telemetry loop) is built by having
 * each run schedule the next one; there is no fixed-rate primitive, so a test
 * scheduler can step ticks one at a time.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock#nowNanos()} scale
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
