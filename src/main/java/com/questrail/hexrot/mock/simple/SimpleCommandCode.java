package com.questrail.hexrot.mock.simple;

/**
 * Command codes understood by {@link SimpleMockController}.
 */
public enum SimpleCommandCode
{
    /** param1 = {@link com.questrail.hexrot.internal.state.SetStateParam} wire value. */
    SET_STATE(1),
    /** param1 = target position. */
    MOVE(2),
    /** param1 = new maximum velocity. */
    CONFIG_VELOCITY(3);

    private final int code;

    SimpleCommandCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
