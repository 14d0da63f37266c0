package com.questrail.hexrot.internal.time;

/**
 * Cancellation handle for a task submitted to a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task will no longer run; {@code false} if it
     *         already ran or was cancelled before
     */
    boolean cancel();
}
