package com.questrail.hexrot.codec.impl;

import com.questrail.hexrot.codec.RecordCodec;
import com.questrail.hexrot.codec.WireFormat;
import com.questrail.hexrot.model.Header;

import java.nio.ByteBuffer;

/**
 * HeaderCodec
 * -----------------------------------------------------------------------------
 * Layout: {@code frame_id u16 | counter u32 | tai_sec i64 | tai_nsec i64}.
 */
public enum HeaderCodec implements RecordCodec<Header>
{
    INSTANCE;

    public static final int SIZE = 2 + 4 + 8 + 8;

    @Override
    public int size() {
        return SIZE;
    }

    @Override
    public void encode(Header value, ByteBuffer out) {
        out.putShort((short) value.frameId());
        out.putInt((int) value.counter());
        out.putLong(value.taiSeconds());
        out.putLong(value.taiNanoseconds());
    }

    @Override
    public Header decode(ByteBuffer in) {
        int frameId = Short.toUnsignedInt(in.getShort());
        long counter = WireFormat.getUnsignedInt(in);
        long seconds = in.getLong();
        long nanos = in.getLong();
        return new Header(frameId, counter, seconds, nanos);
    }

    /**
     * Reads only the frame id from an encoded header, without decoding the rest.
     */
    public static int peekFrameId(byte[] header) {
        if (header.length < 2) {
            throw new IllegalArgumentException("header too short: " + header.length);
        }
        return (header[0] & 0xFF) | ((header[1] & 0xFF) << 8);
    }
}
