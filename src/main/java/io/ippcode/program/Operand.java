package io.ippcode.program;

import io.ippcode.isa.Kind;
import org.jetbrains.annotations.NotNull;

/**
 * One classified argument of an instruction.
 *
 * @param kind     syntactic category; for constants the declared type
 * @param text     normalized value: the whole token for variables, the value without its
 *                 {@code type@} prefix for constants, escapes of strings decoded
 * @param position 1-based position within the instruction
 */
public record Operand(@NotNull Kind kind, @NotNull String text, int position) {

    public Operand {
        if (position < 1) {
            throw new IllegalArgumentException("operand position must be positive, got %d".formatted(position));
        }
    }

    @Override
    public @NotNull String toString() {
        return "%s@%s".formatted(kind.label(), text);
    }
}
