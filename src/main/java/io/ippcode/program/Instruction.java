package io.ippcode.program;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

public record Instruction(int order, @NotNull String opcode, @NotNull Operand @NotNull [] operands) {

    public int arity() {
        return operands.length;
    }

    public @NotNull Operand operand(final int index) {
        return operands[index];
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Instruction other
               && order == other.order
               && opcode.equals(other.opcode)
               && Arrays.equals(operands, other.operands);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * order + opcode.hashCode()) + Arrays.hashCode(operands);
    }

    @Override
    public @NotNull String toString() {
        return "%d: %s %s".formatted(order, opcode, Arrays.toString(operands));
    }
}
