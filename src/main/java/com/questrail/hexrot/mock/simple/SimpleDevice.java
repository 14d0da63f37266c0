package com.questrail.hexrot.mock.simple;

import com.questrail.hexrot.config.LinkConfig;
import com.questrail.hexrot.internal.state.SetStateParam;
import com.questrail.hexrot.link.CommandTelemetryClient;
import com.questrail.hexrot.model.Command;

/**
 * Client-side helpers for talking to a simple device.
 */
public final class SimpleDevice
{
    private SimpleDevice() {}

    public static CommandTelemetryClient<SimpleConfig, SimpleTelemetry> newClient(LinkConfig config) {
        return new CommandTelemetryClient<>(config, SimpleConfigCodec.INSTANCE, SimpleTelemetryCodec.INSTANCE);
    }

    public static Command setState(SetStateParam param) {
        return Command.of(SimpleCommandCode.SET_STATE.code(), param.wireValue());
    }

    public static Command move(double position) {
        return Command.of(SimpleCommandCode.MOVE.code(), position);
    }

    public static Command configVelocity(double maxVelocity) {
        return Command.of(SimpleCommandCode.CONFIG_VELOCITY.code(), maxVelocity);
    }
}
