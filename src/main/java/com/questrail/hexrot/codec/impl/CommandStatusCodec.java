package com.questrail.hexrot.codec.impl;

import com.questrail.hexrot.codec.FrameCodec;
import com.questrail.hexrot.codec.WireFormat;
import com.questrail.hexrot.codec.WireFormatException;
import com.questrail.hexrot.model.CommandStatus;
import com.questrail.hexrot.model.CommandStatusCode;
import com.questrail.hexrot.model.FrameId;

import java.nio.ByteBuffer;

/**
 * CommandStatusCodec
 * -----------------------------------------------------------------------------
 * Layout: {@code status u32 | duration f64 | reason byte[50]}.
 *
 * <p>The reason is UTF-8, truncated to the buffer on encode and NUL padded.
 * Decoding drops the padding, so a truncated reason comes back as its first
 * {@value CommandStatus#REASON_LENGTH} bytes.</p>
 */
public enum CommandStatusCodec implements FrameCodec<CommandStatus>
{
    INSTANCE;

    public static final int SIZE = 4 + 8 + CommandStatus.REASON_LENGTH;

    @Override
    public int frameId() {
        return FrameId.COMMAND_STATUS.wireValue();
    }

    @Override
    public int size() {
        return SIZE;
    }

    @Override
    public void encode(CommandStatus value, ByteBuffer out) {
        out.putInt(value.status().wireValue());
        out.putDouble(value.duration());
        WireFormat.putFixedText(out, value.reason(), CommandStatus.REASON_LENGTH);
    }

    @Override
    public CommandStatus decode(ByteBuffer in) {
        int raw = in.getInt();
        CommandStatusCode status = CommandStatusCode.fromWire(raw)
                .orElseThrow(() -> new WireFormatException("Unknown command status value: " + raw));
        double duration = in.getDouble();
        String reason = WireFormat.getFixedText(in, CommandStatus.REASON_LENGTH);
        return new CommandStatus(status, duration, reason);
    }
}
