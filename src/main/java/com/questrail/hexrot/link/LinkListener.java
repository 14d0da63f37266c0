package com.questrail.hexrot.link;

/**
 * Observer of a {@link CommandTelemetryClient}.
 *
 * <p>Callbacks run on the link's I/O thread in wire order. They must not
 * block and must not call {@link CommandTelemetryClient#runCommand}, which
 * waits for a reply that this same thread delivers. Exceptions thrown here
 * are logged and otherwise ignored.</p>
 *
 * @param <C> device config record
 * @param <T> device telemetry record
 */
public interface LinkListener<C, T>
{
    /**
     * Called when the connection comes up or goes down, once per transition.
     */
    default void onConnectionChange(boolean connected) {}

    default void onConfig(C config) {}

    default void onTelemetry(T telemetry) {}
}
