package io.ippcode.isa;

import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * Named set of operand kinds accepted by one slot of a signature, e.g. {@code symb}.
 */
public record Category(@NotNull String label, @NotNull Set<Kind> kinds) {

    public boolean accepts(final @NotNull Kind kind) {
        return kinds.contains(kind);
    }

    @Override
    public @NotNull String toString() {
        return "type %s %s".formatted(label, kinds);
    }
}
