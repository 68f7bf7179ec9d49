package io.ippcode.isa;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Syntactic category of an operand, named the way it appears in the {@code type}
 * attribute of an argument element.
 */
public enum Kind {

    VAR("var"),
    INT("int"),
    BOOL("bool"),
    STRING("string"),
    NIL("nil"),
    LABEL("label"),
    TYPE("type");

    private final String label;

    Kind(final @NotNull String label) {
        this.label = label;
    }

    public @NotNull String label() {
        return label;
    }

    public static @Nullable Kind byLabel(final @NotNull String label) {
        for (final var kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        return null;
    }
}
