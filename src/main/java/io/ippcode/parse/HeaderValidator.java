package io.ippcode.parse;

import io.ippcode.error.HeaderException;
import io.ippcode.lex.Line;
import org.jetbrains.annotations.Nullable;

import static io.ippcode.Constants.HEADER;

public final class HeaderValidator {

    private HeaderValidator() {
    }

    /**
     * @param line first line with tokens, {@code null} if the input has none
     * @throws HeaderException unless the line is exactly the language marker, in any letter case
     */
    public static void validate(final @Nullable Line line) {
        if (line == null) {
            throw new HeaderException("missing header '%s'", HEADER);
        }
        if (line.size() != 1 || !line.first().equalsIgnoreCase(HEADER)) {
            throw new HeaderException("line %d: expected header '%s', got '%s'",
                                      line.number(),
                                      HEADER,
                                      String.join(" ", line.tokens()));
        }
    }
}
