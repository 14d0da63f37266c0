package com.questrail.hexrot.codec;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * RecordCodec
 * =============================================================================
 * Byte-exact encoder/decoder for one fixed-size wire record.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #encode(Object, ByteBuffer)} writes exactly {@link #size()} bytes,
 *       whatever the field values.</li>
 *   <li>{@link #decode(ByteBuffer)} reads exactly {@link #size()} bytes.</li>
 *   <li>Buffers are little-endian; use {@link WireFormat} to obtain them.</li>
 * </ul>
 *
 * <p>Codecs are stateless and thread-safe.</p>
 *
 * @param <T> the record type
 */
public interface RecordCodec<T>
{
    /**
     * Encoded size of the record in bytes.
     */
    int size();

    void encode(T value, ByteBuffer out);

    T decode(ByteBuffer in);

    default byte[] encode(T value) {
        Objects.requireNonNull(value, "value");
        ByteBuffer buf = WireFormat.allocate(size());
        encode(value, buf);
        return buf.array();
    }

    /**
     * Decodes a complete record.
     *
     * @throws IllegalArgumentException if {@code bytes} is not exactly {@link #size()} long
     * @throws WireFormatException      if a field holds a value the record cannot represent
     */
    default T decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != size()) {
            throw new IllegalArgumentException(
                    "expected " + size() + " bytes, got " + bytes.length);
        }
        return decode(WireFormat.wrap(bytes));
    }
}
