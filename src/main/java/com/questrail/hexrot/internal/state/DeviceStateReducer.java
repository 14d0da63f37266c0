package com.questrail.hexrot.internal.state;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * DeviceStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition table for SET_STATE commands.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link DeviceState} and a {@link SetStateParam}, the reducer
 * decides whether the command is legal and, if so, which state results. It
 * performs no I/O and holds no state; the mock controller applies the result
 * and reports it on the wire.
 *
 * <h2>Table</h2>
 * <pre>
 *   ENTER_CONTROL  OFFLINE (AVAILABLE)  -> STANDBY
 *   START          STANDBY              -> DISABLED
 *   ENABLE         DISABLED             -> ENABLED
 *   DISABLE        ENABLED              -> DISABLED
 *   STANDBY        DISABLED             -> STANDBY
 *   EXIT           STANDBY              -> OFFLINE
 *   CLEAR_ERROR    FAULT or STANDBY     -> STANDBY
 * </pre>
 *
 * Anything else is rejected with a reason naming the current and required
 * states, short enough to fit a command status reason; a rejection never
 * changes state.
 */
public final class DeviceStateReducer
{
    /**
     * Result of applying a SET_STATE command.
     *
     * @param newState        state after the command; equal to the prior state on rejection
     * @param rejectionReason {@code null} when the command was accepted
     */
    public record Result(DeviceState newState, String rejectionReason)
    {
        public Result {
            Objects.requireNonNull(newState, "newState");
        }

        public boolean isAccepted() {
            return rejectionReason == null;
        }
    }

    private record Transition(Set<ControllerState> required, ControllerState target) {}

    private final Map<SetStateParam, Transition> table = new EnumMap<>(SetStateParam.class);

    public DeviceStateReducer() {
        table.put(SetStateParam.ENTER_CONTROL, new Transition(EnumSet.of(ControllerState.OFFLINE), ControllerState.STANDBY));
        table.put(SetStateParam.START, new Transition(EnumSet.of(ControllerState.STANDBY), ControllerState.DISABLED));
        table.put(SetStateParam.ENABLE, new Transition(EnumSet.of(ControllerState.DISABLED), ControllerState.ENABLED));
        table.put(SetStateParam.DISABLE, new Transition(EnumSet.of(ControllerState.ENABLED), ControllerState.DISABLED));
        table.put(SetStateParam.STANDBY, new Transition(EnumSet.of(ControllerState.DISABLED), ControllerState.STANDBY));
        table.put(SetStateParam.EXIT, new Transition(EnumSet.of(ControllerState.STANDBY), ControllerState.OFFLINE));
        table.put(SetStateParam.CLEAR_ERROR,
                new Transition(EnumSet.of(ControllerState.FAULT, ControllerState.STANDBY), ControllerState.STANDBY));
    }

    public Result apply(DeviceState state, SetStateParam param) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(param, "param");

        Transition t = table.get(param);

        if (!t.required().contains(state.state())) {
            return new Result(state, "state=" + state.state() + "; must be " + describe(t.required()));
        }
        if (param == SetStateParam.ENTER_CONTROL && state.offlineSubstate() != OfflineSubstate.AVAILABLE) {
            return new Result(state, "offline substate=" + state.offlineSubstate() + "; must be AVAILABLE");
        }

        return new Result(DeviceState.entering(t.target()), null);
    }

    private static String describe(Set<ControllerState> states) {
        return states.stream().map(Enum::name).collect(Collectors.joining(" or "));
    }
}
