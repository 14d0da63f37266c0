package com.questrail.hexrot.codec.impl;

import com.questrail.hexrot.codec.RecordCodec;
import com.questrail.hexrot.codec.WireFormat;
import com.questrail.hexrot.model.Command;

import java.nio.ByteBuffer;

/**
 * CommandCodec
 * -----------------------------------------------------------------------------
 * Layout: {@code commander u32 | counter u32 | code u32 | param1..param6 f64}.
 */
public enum CommandCodec implements RecordCodec<Command>
{
    INSTANCE;

    public static final int SIZE = 4 + 4 + 4 + Command.PARAM_COUNT * 8;

    @Override
    public int size() {
        return SIZE;
    }

    @Override
    public void encode(Command value, ByteBuffer out) {
        out.putInt(value.commander());
        out.putInt((int) value.counter());
        out.putInt(value.code());
        for (int i = 1; i <= Command.PARAM_COUNT; i++) {
            out.putDouble(value.param(i));
        }
    }

    @Override
    public Command decode(ByteBuffer in) {
        int commander = in.getInt();
        long counter = WireFormat.getUnsignedInt(in);
        int code = in.getInt();
        return new Command(commander, counter, code,
                in.getDouble(), in.getDouble(), in.getDouble(),
                in.getDouble(), in.getDouble(), in.getDouble());
    }
}
