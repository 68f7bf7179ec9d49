package io.ippcode.program;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

public record Program(@NotNull String language, @NotNull Instruction @NotNull [] instructions) {

    public int size() {
        return instructions.length;
    }

    public @NotNull Instruction instruction(final int index) {
        return instructions[index];
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Program other
               && language.equals(other.language)
               && Arrays.equals(instructions, other.instructions);
    }

    @Override
    public int hashCode() {
        return 31 * language.hashCode() + Arrays.hashCode(instructions);
    }
}
