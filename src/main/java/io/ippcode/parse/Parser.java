package io.ippcode.parse;

import io.ippcode.isa.Registry;
import io.ippcode.lex.LineTokenizer;
import io.ippcode.program.Program;
import io.ippcode.program.ProgramBuilder;
import io.ippcode.util.Log;
import org.jetbrains.annotations.NotNull;

import java.io.InputStream;

import static io.ippcode.Constants.LANGUAGE;

/**
 * Validates a whole source program and builds its model. Any error aborts the
 * run by exception; a returned program is always complete.
 */
public final class Parser {

    private final Registry registry;
    private final ParseListener listener;

    public Parser(final @NotNull Registry registry) {
        this(registry, ParseListener.NONE);
    }

    public Parser(final @NotNull Registry registry, final @NotNull ParseListener listener) {
        this.registry = registry;
        this.listener = listener;
    }

    public @NotNull Program parse(final @NotNull InputStream stream) {
        final var tokenizer  = LineTokenizer.of(stream, listener::onComment);
        final var recognizer = new InstructionRecognizer(registry);
        final var builder    = ProgramBuilder.create(LANGUAGE);

        HeaderValidator.validate(tokenizer.next());

        for (var line = tokenizer.next(); line != null; line = tokenizer.next()) {
            listener.onInstruction(recognizer.recognize(line, builder));
        }

        Log.info("parsed %d instructions", builder.size());
        return builder.build();
    }
}
