package io.ippcode.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static io.ippcode.Constants.EXIT_INTERNAL;

public final class InternalException extends ParseException {

    public InternalException(final @NotNull String message, final @Nullable Throwable cause) {
        super(EXIT_INTERNAL, message, cause);
    }
}
