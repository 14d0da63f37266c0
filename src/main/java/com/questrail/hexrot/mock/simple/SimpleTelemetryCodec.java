package com.questrail.hexrot.mock.simple;

import com.questrail.hexrot.codec.FrameCodec;
import com.questrail.hexrot.model.FrameId;

import java.nio.ByteBuffer;

/**
 * Three uint32 state fields followed by two float64 positions.
 */
public enum SimpleTelemetryCodec implements FrameCodec<SimpleTelemetry>
{
    INSTANCE;

    public static final int SIZE = 3 * 4 + 2 * 8;

    @Override
    public int frameId() {
        return FrameId.TELEMETRY.wireValue();
    }

    @Override
    public int size() {
        return SIZE;
    }

    @Override
    public void encode(SimpleTelemetry value, ByteBuffer out) {
        out.putInt(value.state());
        out.putInt(value.enabledSubstate());
        out.putInt(value.offlineSubstate());
        out.putDouble(value.currentPosition());
        out.putDouble(value.commandedPosition());
    }

    @Override
    public SimpleTelemetry decode(ByteBuffer in) {
        return new SimpleTelemetry(in.getInt(), in.getInt(), in.getInt(), in.getDouble(), in.getDouble());
    }
}
