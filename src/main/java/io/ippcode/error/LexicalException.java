package io.ippcode.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static io.ippcode.Constants.EXIT_OTHER;

/**
 * Any lexical or syntactic error that is neither a header nor an opcode problem.
 */
public class LexicalException extends ParseException {

    private final int line;

    public LexicalException(final int line, final @NotNull String message) {
        this(line, message, null);
    }

    public LexicalException(final int line, final @NotNull String message, final @Nullable Throwable cause) {
        super(EXIT_OTHER, line > 0 ? "line %d: %s".formatted(line, message) : message, cause);
        this.line = line;
    }

    /**
     * @return the 1-based input line, or 0 if the error is not bound to a line
     */
    public int getLine() {
        return line;
    }
}
