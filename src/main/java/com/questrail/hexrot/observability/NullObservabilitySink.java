package com.questrail.hexrot.observability;

/**
 * No-op implementation of HexrotObservabilitySink.
 */
public final class NullObservabilitySink implements HexrotObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(HexrotStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(HexrotProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(HexrotTransportObservabilityEvent event) {}

    @Override
    public void onError(HexrotErrorEvent event) {}
}
