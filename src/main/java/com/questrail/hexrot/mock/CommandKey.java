package com.questrail.hexrot.mock;

import java.util.OptionalInt;

/**
 * Dispatch key for a mock controller's command table: a command code, plus
 * the integer value of {@code param1} for codes that multiplex several
 * operations (SET_STATE being the standard example).
 */
public record CommandKey(int code, OptionalInt subCommand)
{
    public static CommandKey of(int code) {
        return new CommandKey(code, OptionalInt.empty());
    }

    public static CommandKey of(int code, int subCommand) {
        return new CommandKey(code, OptionalInt.of(subCommand));
    }

    public boolean isMultiPurpose() {
        return subCommand.isPresent();
    }
}
