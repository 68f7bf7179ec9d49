package io.ippcode.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base of every failure the parser reports. Each subclass maps to exactly one process exit code,
 * the command line catches this type once and terminates with {@link #getExitCode()}.
 */
public abstract class ParseException extends RuntimeException {

    private final int exitCode;

    protected ParseException(final int exitCode, final @NotNull String message) {
        super(message);
        this.exitCode = exitCode;
    }

    protected ParseException(final int exitCode, final @NotNull String message, final @Nullable Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
