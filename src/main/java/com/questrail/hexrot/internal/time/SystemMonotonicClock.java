package com.questrail.hexrot.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Tests substitute a manually advanced clock.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
