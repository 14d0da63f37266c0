package com.questrail.hexrot.codec;

/**
 * A {@link RecordCodec} for a payload that travels behind a header, and so
 * declares the frame id that announces it.
 *
 * <p>Device-specific config and telemetry codecs implement this interface;
 * the link is parameterized by them.</p>
 */
public interface FrameCodec<T> extends RecordCodec<T>
{
    int frameId();
}
