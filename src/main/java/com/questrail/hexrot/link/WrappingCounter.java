package com.questrail.hexrot.link;

/**
 * WrappingCounter
 * -----------------------------------------------------------------------------
 * Unsigned counter of a fixed bit width with modular increment.
 *
 * <p>{@link #next()} returns the current value and advances it, wrapping from
 * {@code 2^bits - 1} back to 0. Values are always in {@code [0, 2^bits)}.</p>
 *
 * <p>Not thread-safe; the link only advances it while holding its command lock.</p>
 */
public final class WrappingCounter
{
    private final long mask;
    private long value;

    public WrappingCounter(int bits) {
        this(bits, 0L);
    }

    public WrappingCounter(int bits, long origin) {
        if (bits < 1 || bits > 63) {
            throw new IllegalArgumentException("bits must be in 1..63: " + bits);
        }
        this.mask = (1L << bits) - 1;
        if (origin < 0 || origin > mask) {
            throw new IllegalArgumentException("origin out of range for " + bits + " bits: " + origin);
        }
        this.value = origin;
    }

    public long next() {
        long current = value;
        value = (value + 1) & mask;
        return current;
    }

    public long peek() {
        return value;
    }

    public long maxValue() {
        return mask;
    }
}
