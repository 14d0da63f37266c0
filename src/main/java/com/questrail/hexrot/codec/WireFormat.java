package com.questrail.hexrot.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Shared wire conventions: little-endian, byte-packed, fixed-width text fields.
 */
public final class WireFormat
{
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private WireFormat() {}

    public static ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(BYTE_ORDER);
    }

    public static ByteBuffer wrap(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(BYTE_ORDER);
    }

    /**
     * Writes {@code text} as UTF-8 into a fixed field of {@code width} bytes,
     * truncating overflow and padding the remainder with NUL. Truncation never
     * splits a multi-byte character.
     */
    public static void putFixedText(ByteBuffer out, String text, int width) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        int length = Math.min(utf8.length, width);
        if (length < utf8.length) {
            // utf8[length] is the first dropped byte; back off while it continues a character
            while (length > 0 && (utf8[length] & 0xC0) == 0x80) {
                length--;
            }
        }
        byte[] field = Arrays.copyOf(Arrays.copyOf(utf8, length), width);
        out.put(field);
    }

    /**
     * Reads a fixed text field of {@code width} bytes, dropping trailing NULs.
     */
    public static String getFixedText(ByteBuffer in, int width) {
        byte[] field = new byte[width];
        in.get(field);
        int end = width;
        while (end > 0 && field[end - 1] == 0) {
            end--;
        }
        return new String(field, 0, end, StandardCharsets.UTF_8);
    }

    public static long getUnsignedInt(ByteBuffer in) {
        return Integer.toUnsignedLong(in.getInt());
    }
}
