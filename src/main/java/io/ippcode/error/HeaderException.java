package io.ippcode.error;

import org.jetbrains.annotations.NotNull;

import static io.ippcode.Constants.EXIT_HEADER;

public final class HeaderException extends ParseException {

    public HeaderException(final @NotNull String message) {
        super(EXIT_HEADER, message);
    }

    public HeaderException(final @NotNull String format, final Object @NotNull ... args) {
        this(format.formatted(args));
    }
}
