package io.ippcode.program;

import com.carrotsearch.hppc.ObjectArrayList;
import com.carrotsearch.hppc.ObjectIndexedContainer;
import io.ippcode.util.Buildable;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Append-only accumulator of validated instructions. Order numbers are assigned
 * here, starting at 1, in the order instructions are appended.
 */
public final class ProgramBuilder implements Buildable<Program> {

    public static @NotNull ProgramBuilder create(final @NotNull String language) {
        return new ProgramBuilder(language);
    }

    private final String language;
    private final ObjectIndexedContainer<Instruction> instructions = new ObjectArrayList<>();
    private boolean built;

    private ProgramBuilder(final @NotNull String language) {
        this.language = language;
    }

    public @NotNull Instruction append(final @NotNull String opcode, final @NotNull List<Operand> operands) {
        if (built) {
            throw new IllegalStateException("program already built");
        }

        final var instruction = new Instruction(instructions.size() + 1, opcode, operands.toArray(Operand[]::new));
        instructions.add(instruction);
        return instruction;
    }

    public int size() {
        return instructions.size();
    }

    @Override
    public @NotNull Program build() {
        built = true;
        return new Program(language, instructions.toArray(Instruction.class));
    }
}
