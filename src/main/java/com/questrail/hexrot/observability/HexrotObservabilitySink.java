package com.questrail.hexrot.observability;

/**
 * Main interface for receiving link and mock controller observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Calls arrive on I/O and executor threads; implementations must be
 * thread-safe and must not block.</p>
 */
public interface HexrotObservabilitySink {
    /**
     * Called when a mock controller applies a device state transition.
     */
    void onStateTransition(HexrotStateTransitionEvent event);

    /**
     * Called for protocol-level occurrences (command sent, acknowledged, rejected,
     * timed out, discarded status, unrecognized frame).
     */
    void onProtocolEvent(HexrotProtocolObservabilityEvent event);

    /**
     * Called when a connection comes up or goes down.
     */
    void onTransportEvent(HexrotTransportObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs, including listener failures.
     */
    void onError(HexrotErrorEvent event);
}
