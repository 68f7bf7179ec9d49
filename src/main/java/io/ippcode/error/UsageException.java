package io.ippcode.error;

import org.jetbrains.annotations.NotNull;

import static io.ippcode.Constants.EXIT_USAGE;

public final class UsageException extends ParseException {

    public UsageException(final @NotNull String message) {
        super(EXIT_USAGE, message);
    }

    public UsageException(final @NotNull String format, final Object @NotNull ... args) {
        this(format.formatted(args));
    }
}
