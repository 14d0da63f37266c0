package com.questrail.hexrot.internal.state;

import java.util.Objects;

/**
 * DeviceState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a controller's primary state and both substates.
 *
 * <p>A substate is only meaningful under its own primary state; every other
 * state carries {@code NONE} for it. Use {@link #entering(ControllerState)} to
 * obtain the canonical snapshot for a freshly entered state.</p>
 */
public record DeviceState(ControllerState state,
                          EnabledSubstate enabledSubstate,
                          OfflineSubstate offlineSubstate)
{
    public DeviceState {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(enabledSubstate, "enabledSubstate");
        Objects.requireNonNull(offlineSubstate, "offlineSubstate");
    }

    /**
     * The snapshot reported immediately after a transition into {@code state}:
     * OFFLINE is AVAILABLE, ENABLED is STATIONARY, all others clear both substates.
     */
    public static DeviceState entering(ControllerState state) {
        return switch (state) {
            case OFFLINE -> new DeviceState(state, EnabledSubstate.NONE, OfflineSubstate.AVAILABLE);
            case ENABLED -> new DeviceState(state, EnabledSubstate.STATIONARY, OfflineSubstate.NONE);
            default -> new DeviceState(state, EnabledSubstate.NONE, OfflineSubstate.NONE);
        };
    }

    public DeviceState withEnabledSubstate(EnabledSubstate substate) {
        if (state != ControllerState.ENABLED) {
            throw new IllegalStateException("enabled substate only applies in ENABLED, not " + state);
        }
        return new DeviceState(state, substate, offlineSubstate);
    }

    public DeviceState withOfflineSubstate(OfflineSubstate substate) {
        if (state != ControllerState.OFFLINE) {
            throw new IllegalStateException("offline substate only applies in OFFLINE, not " + state);
        }
        return new DeviceState(state, enabledSubstate, substate);
    }
}
