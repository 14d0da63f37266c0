package com.questrail.hexrot.codec.impl;

import com.questrail.hexrot.codec.FrameCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * FrameCatalog
 * -----------------------------------------------------------------------------
 * The set of frames a reader accepts after a {@link HeaderCodec header}, and
 * the payload size each one declares.
 *
 * <h2>Resynchronization</h2>
 * When a header names a frame id that is not in the catalog, the reader cannot
 * know how long the payload is. It discards exactly {@link #resyncSize()}
 * bytes (the largest payload it knows) and resumes reading headers there.
 */
public final class FrameCatalog
{
    private final Map<Integer, Integer> payloadSizes;
    private final int resyncSize;

    private FrameCatalog(Map<Integer, Integer> payloadSizes) {
        this.payloadSizes = Collections.unmodifiableMap(payloadSizes);
        this.resyncSize = payloadSizes.values().stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElseThrow(() -> new IllegalArgumentException("catalog must declare at least one frame"));
    }

    /**
     * Builds a catalog from the codecs of every accepted frame.
     *
     * @throws IllegalArgumentException if two codecs declare the same frame id
     */
    public static FrameCatalog of(FrameCodec<?>... codecs) {
        Map<Integer, Integer> sizes = new LinkedHashMap<>();
        for (FrameCodec<?> codec : codecs) {
            Objects.requireNonNull(codec, "codec");
            Integer previous = sizes.putIfAbsent(codec.frameId(), codec.size());
            if (previous != null) {
                throw new IllegalArgumentException("duplicate frame id: " + codec.frameId());
            }
        }
        return new FrameCatalog(sizes);
    }

    public int headerSize() {
        return HeaderCodec.SIZE;
    }

    public int frameIdOf(byte[] header) {
        return HeaderCodec.peekFrameId(header);
    }

    public OptionalInt payloadSize(int frameId) {
        Integer size = payloadSizes.get(frameId);
        return size == null ? OptionalInt.empty() : OptionalInt.of(size);
    }

    public int resyncSize() {
        return resyncSize;
    }

    @Override
    public String toString() {
        return "FrameCatalog" + payloadSizes;
    }
}
