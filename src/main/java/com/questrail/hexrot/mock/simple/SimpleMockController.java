package com.questrail.hexrot.mock.simple;

import com.questrail.hexrot.config.MockControllerConfig;
import com.questrail.hexrot.internal.state.ControllerState;
import com.questrail.hexrot.internal.state.DeviceState;
import com.questrail.hexrot.internal.state.EnabledSubstate;
import com.questrail.hexrot.mock.BaseMockController;
import com.questrail.hexrot.mock.CommandHandler;
import com.questrail.hexrot.mock.CommandKey;
import com.questrail.hexrot.mock.DeviceCommandException;
import com.questrail.hexrot.mock.MockControllerRuntime;
import com.questrail.hexrot.model.Command;

import java.util.Map;

/**
 * SimpleMockController
 * =============================================================================
 * Single-axis device used to exercise the link end to end.
 *
 * <p>MOVE sets the commanded position; the current position then slews toward
 * it at the configured maximum velocity, one step per telemetry tick, and the
 * enabled substate stays MOVING_POINT_TO_POINT until it arrives. Leaving
 * ENABLED halts the axis where it is.</p>
 */
public final class SimpleMockController extends BaseMockController<SimpleConfig, SimpleTelemetry>
{
    private volatile double currentPosition;
    private volatile double commandedPosition;

    public SimpleMockController(MockControllerConfig config) {
        this(config, ControllerState.OFFLINE, MockControllerRuntime.builder(config).build());
    }

    public SimpleMockController(MockControllerConfig config, ControllerState initialState, MockControllerRuntime runtime) {
        super(config,
                SimpleConfigCodec.INSTANCE,
                SimpleTelemetryCodec.INSTANCE,
                SimpleConfig.DEFAULT,
                initialState,
                SimpleCommandCode.SET_STATE.code(),
                runtime);
    }

    public double currentPosition() {
        return currentPosition;
    }

    public double commandedPosition() {
        return commandedPosition;
    }

    @Override
    protected Map<CommandKey, CommandHandler> extraCommands() {
        return Map.of(
                CommandKey.of(SimpleCommandCode.MOVE.code()), this::doMove,
                CommandKey.of(SimpleCommandCode.CONFIG_VELOCITY.code()), this::doConfigVelocity);
    }

    @Override
    protected SimpleTelemetry telemetry() {
        return SimpleTelemetry.of(deviceState(), currentPosition, commandedPosition);
    }

    @Override
    protected void updateTelemetry(double elapsedSeconds) {
        DeviceState state = deviceState();
        if (state.enabledSubstate() != EnabledSubstate.MOVING_POINT_TO_POINT) {
            return;
        }

        double remaining = commandedPosition - currentPosition;
        double step = config().maxVelocity() * elapsedSeconds;
        if (Math.abs(remaining) <= step) {
            currentPosition = commandedPosition;
            setDeviceState(state.withEnabledSubstate(EnabledSubstate.STATIONARY), null);
        }
        else {
            currentPosition += Math.signum(remaining) * step;
        }
    }

    @Override
    protected void onStateChanged(DeviceState previous, DeviceState current) {
        if (previous.state() == ControllerState.ENABLED && current.state() != ControllerState.ENABLED) {
            commandedPosition = currentPosition;
        }
    }

    private double doMove(Command command) {
        assertState(ControllerState.ENABLED);

        SimpleConfig cfg = config();
        double target = command.param1();
        // NaN fails the range check.
        if (!cfg.inRange(target)) {
            throw new DeviceCommandException(
                    "position " + target + " not in [" + cfg.minPosition() + ", " + cfg.maxPosition() + "]");
        }

        double duration = Math.abs(target - currentPosition) / cfg.maxVelocity();
        commandedPosition = target;
        if (duration > 0) {
            setDeviceState(deviceState().withEnabledSubstate(EnabledSubstate.MOVING_POINT_TO_POINT), command);
        }
        return duration;
    }

    private double doConfigVelocity(Command command) {
        assertState(ControllerState.ENABLED);

        double maxVelocity = command.param1();
        if (!(maxVelocity > 0)) {
            throw new DeviceCommandException("max velocity " + maxVelocity + " must be > 0");
        }
        setConfig(config().withMaxVelocity(maxVelocity));
        return 0.0;
    }
}
