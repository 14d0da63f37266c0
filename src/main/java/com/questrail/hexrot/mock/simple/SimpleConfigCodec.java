package com.questrail.hexrot.mock.simple;

import com.questrail.hexrot.codec.FrameCodec;
import com.questrail.hexrot.model.FrameId;

import java.nio.ByteBuffer;

/**
 * Three little-endian float64 fields: min position, max position, max velocity.
 */
public enum SimpleConfigCodec implements FrameCodec<SimpleConfig>
{
    INSTANCE;

    public static final int SIZE = 3 * 8;

    @Override
    public int frameId() {
        return FrameId.CONFIG.wireValue();
    }

    @Override
    public int size() {
        return SIZE;
    }

    @Override
    public void encode(SimpleConfig value, ByteBuffer out) {
        out.putDouble(value.minPosition());
        out.putDouble(value.maxPosition());
        out.putDouble(value.maxVelocity());
    }

    @Override
    public SimpleConfig decode(ByteBuffer in) {
        return new SimpleConfig(in.getDouble(), in.getDouble(), in.getDouble());
    }
}
