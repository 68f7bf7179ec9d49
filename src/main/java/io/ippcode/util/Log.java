package io.ippcode.util;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

/**
 * Diagnostics on the error stream. Levels: 0 error, 1 warning, 2 info; the
 * active level is read from the system property {@code ippcode.log.level}.
 */
public final class Log {

    private static final int LEVEL = Integer.getInteger("ippcode.log.level", 1);

    private static final PrintStream out = System.err;

    public static void info(final @NotNull String message) {
        if (LEVEL >= 2) {
            out.println("[ info ] " + message);
        }
    }

    public static void info(final @NotNull String message, final @NotNull Object... args) {
        prepare(args);
        info(message.formatted(args));
    }

    public static void warn(final @NotNull String message) {
        if (LEVEL >= 1) {
            out.println("[ warning ] " + message);
        }
    }

    public static void warn(final @NotNull String message, final @NotNull Object... args) {
        prepare(args);
        warn(message.formatted(args));
    }

    public static void error(final @NotNull String message) {
        if (LEVEL >= 0) {
            out.println("[ error ] " + message);
        }
    }

    public static void error(final @NotNull String message, final @NotNull Object... args) {
        prepare(args);
        error(message.formatted(args));
    }

    private static void prepare(final @NotNull Object[] args) {
        for (int i = 0; i < args.length; ++i) {
            if (args[i] instanceof Throwable throwable) {
                final var stream = new ByteArrayOutputStream();
                throwable.printStackTrace(new PrintStream(stream));
                args[i] = stream.toString();
            }
        }
    }

    private Log() {
    }
}
