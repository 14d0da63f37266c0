package com.questrail.hexrot.model;

import java.time.Instant;

/**
 * Header
 * =============================================================================
 * Fixed-size preamble written immediately before every controller-to-link
 * payload.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code frameId} - unsigned 16-bit payload discriminator (see {@link FrameId})</li>
 *   <li>{@code counter} - unsigned 32-bit counter, advancing per frame kind;
 *       for a {@link CommandStatus} it equals the acknowledged command's counter</li>
 *   <li>{@code taiSeconds}/{@code taiNanoseconds} - TAI timestamp of the frame</li>
 * </ul>
 */
public record Header(int frameId, long counter, long taiSeconds, long taiNanoseconds)
{
    /** Current TAI - UTC offset, in seconds. */
    public static final long TAI_MINUS_UTC_SECONDS = 37L;

    public Header {
        if (frameId < 0 || frameId > 0xFFFF) {
            throw new IllegalArgumentException("frameId out of uint16 range: " + frameId);
        }
        if (counter < 0 || counter > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("counter out of uint32 range: " + counter);
        }
    }

    /**
     * Builds a header stamped with the TAI equivalent of the given UTC instant.
     */
    public static Header stamped(int frameId, long counter, Instant utc) {
        Instant tai = utc.plusSeconds(TAI_MINUS_UTC_SECONDS);
        return new Header(frameId, counter, tai.getEpochSecond(), tai.getNano());
    }

    public boolean isFrame(FrameId id) {
        return frameId == id.wireValue();
    }
}
