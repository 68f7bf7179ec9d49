package io.ippcode;

import io.ippcode.error.InternalException;
import io.ippcode.error.ParseException;
import io.ippcode.isa.Registry;
import io.ippcode.parse.Parser;
import io.ippcode.stats.Stats;
import io.ippcode.util.ArgContext;
import io.ippcode.util.Log;
import io.ippcode.xml.ProgramSerializer;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static io.ippcode.Constants.EXIT_INTERNAL;
import static io.ippcode.Constants.EXIT_OK;

public final class Main {

    public static void main(final @NotNull String @NotNull [] args) {
        System.exit(run(args, System.in, System.out));
    }

    /**
     * Run the parser once: validate arguments, read the whole program from {@code in},
     * write the XML document to {@code out}, then the requested statistics files.
     *
     * @return process exit code
     */
    public static int run(
            final @NotNull String @NotNull [] args,
            final @NotNull InputStream in,
            final @NotNull OutputStream out
    ) {
        try {
            final var context = new ArgContext();
            context.parse(args);

            if (context.isHelp()) {
                write(ArgContext.usage(), out);
                return EXIT_OK;
            }

            final var stats   = new Stats();
            final var program = new Parser(Registry.load(), stats).parse(in);

            write(ProgramSerializer.serialize(program).write(), out);

            if (context.hasStats()) {
                context.getAll(group -> group.write(stats));
                Log.info("wrote statistics");
            }

            return EXIT_OK;
        } catch (final ParseException e) {
            Log.error("%s", e.getMessage());
            return e.getExitCode();
        } catch (final RuntimeException e) {
            Log.error("internal error: %s", e);
            return EXIT_INTERNAL;
        }
    }

    private static void write(final @NotNull String text, final @NotNull OutputStream out) {
        try {
            out.write(text.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (final IOException e) {
            throw new InternalException("failed to write output", e);
        }
        if (out instanceof PrintStream stream && stream.checkError()) {
            throw new InternalException("failed to write output", null);
        }
    }

    private Main() {
    }
}
