package com.questrail.hexrot.model;

/**
 * Command
 * =============================================================================
 * One operation request sent from the link to the controller.
 *
 * <h2>Identity</h2>
 * A command carries its own {@code commander} tag and {@code counter}; the
 * link stamps both immediately before writing, so callers build commands with
 * {@link #of(int, double...)} and never choose a counter themselves.
 *
 * <h2>Encoding notes</h2>
 * {@code commander} and {@code code} are unsigned 32-bit values on the wire and
 * are kept as raw {@code int} bits here. {@code counter} is held as a
 * non-negative {@code long} in the uint32 range so that counter arithmetic
 * stays unsigned.
 */
public record Command(
        int commander,
        long counter,
        int code,
        double param1,
        double param2,
        double param3,
        double param4,
        double param5,
        double param6
) {
    /** Commander tag used for commands issued by a supervisory controller. */
    public static final int DEFAULT_COMMANDER = 2;

    public static final int PARAM_COUNT = 6;

    public Command {
        if (counter < 0 || counter > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("counter out of uint32 range: " + counter);
        }
    }

    /**
     * Creates an unstamped command (commander and counter zero).
     *
     * @param code   command code
     * @param params up to six parameters; missing ones are zero
     */
    public static Command of(int code, double... params) {
        if (params.length > PARAM_COUNT) {
            throw new IllegalArgumentException("at most " + PARAM_COUNT + " parameters, got " + params.length);
        }
        double[] p = new double[PARAM_COUNT];
        System.arraycopy(params, 0, p, 0, params.length);
        return new Command(0, 0L, code, p[0], p[1], p[2], p[3], p[4], p[5]);
    }

    public Command withCommander(int commander) {
        return new Command(commander, counter, code, param1, param2, param3, param4, param5, param6);
    }

    public Command withCounter(long counter) {
        return new Command(commander, counter, code, param1, param2, param3, param4, param5, param6);
    }

    /**
     * Returns parameter {@code index} (1-based, matching the wire field names).
     */
    public double param(int index) {
        return switch (index) {
            case 1 -> param1;
            case 2 -> param2;
            case 3 -> param3;
            case 4 -> param4;
            case 5 -> param5;
            case 6 -> param6;
            default -> throw new IllegalArgumentException("param index must be 1.." + PARAM_COUNT + ": " + index);
        };
    }
}
