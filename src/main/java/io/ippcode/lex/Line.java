package io.ippcode.lex;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Tokens of one input line that carried at least one token.
 *
 * @param number 1-based physical line number
 * @param tokens comment-stripped, non-empty tokens
 */
public record Line(int number, @NotNull List<String> tokens) {

    public @NotNull String first() {
        return tokens.get(0);
    }

    public @NotNull List<String> rest() {
        return tokens.subList(1, tokens.size());
    }

    public int size() {
        return tokens.size();
    }
}
