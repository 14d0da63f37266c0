package com.questrail.hexrot.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of HexrotObservabilitySink that emits logs via SLF4J.
 *
 * <p>Unrecognized frames are logged at ERROR and discarded command statuses at
 * WARN; routine command traffic stays at DEBUG.</p>
 */
public final class Slf4jHexrotObservabilitySink implements HexrotObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHexrotObservabilitySink.class);

    @Override
    public void onStateTransition(HexrotStateTransitionEvent event) {
        if (event.isControllerStateChange()) {
            log.info("Controller state: {} -> {}",
                event.oldState().state(),
                event.newState().state());
        }
        else if (!event.oldState().equals(event.newState())) {
            log.debug("Controller substate: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onProtocolEvent(HexrotProtocolObservabilityEvent event) {
        switch (event.kind()) {
            case UNRECOGNIZED_FRAME ->
                log.error("Unrecognized frame: {}", event.detail());
            case COMMAND_STATUS_DISCARDED ->
                log.warn("Discarding command status for counter {}: {}", event.counter(), event.detail());
            case COMMAND_TIMED_OUT ->
                log.warn("Command {} timed out: {}", event.counter(), event.detail());
            case COMMAND_REJECTED ->
                log.info("Command {} rejected: {}", event.counter(), event.detail());
            default ->
                log.debug("Protocol event: {}", event);
        }
    }

    @Override
    public void onTransportEvent(HexrotTransportObservabilityEvent event) {
        if (event.cause() != null) {
            log.warn("Transport {} {}: {}", event.endpoint(), event.kind(), event.cause().toString());
        }
        else {
            log.info("Transport {} {}", event.endpoint(), event.kind());
        }
    }

    @Override
    public void onError(HexrotErrorEvent event) {
        log.error("Error: {}", event.message(), event.cause());
    }
}
