package com.questrail.hexrot.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for everything that paces or bounds protocol activity: the
 * mock controller's telemetry cadence and any elapsed-time measurement.
 *
 * <p>Frame timestamps are the only place wall-clock time is allowed; see
 * {@link WallClock}.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
