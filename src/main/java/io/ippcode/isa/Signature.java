package io.ippcode.isa;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

public record Signature(@NotNull String mnemonic, @NotNull Category @NotNull [] operands) {

    public int arity() {
        return operands.length;
    }

    public @NotNull Category operand(final int index) {
        return operands[index];
    }

    @Override
    public @NotNull String toString() {
        return "%s %s".formatted(mnemonic, Arrays.toString(operands));
    }
}
