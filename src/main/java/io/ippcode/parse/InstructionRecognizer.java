package io.ippcode.parse;

import io.ippcode.error.ArityException;
import io.ippcode.error.LexicalException;
import io.ippcode.error.OpcodeException;
import io.ippcode.isa.Registry;
import io.ippcode.lex.Line;
import io.ippcode.lex.OperandClassifier;
import io.ippcode.program.Instruction;
import io.ippcode.program.Operand;
import io.ippcode.program.ProgramBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns one tokenized line into an instruction. Checks run in a fixed order and
 * the first failure wins: opcode spelling, opcode lookup, arity, then operands
 * from left to right.
 */
public final class InstructionRecognizer {

    private static final Pattern OPCODE_PATTERN = Pattern.compile("^[A-Za-z0-9]+$");

    private final Registry registry;

    public InstructionRecognizer(final @NotNull Registry registry) {
        this.registry = registry;
    }

    public @NotNull Instruction recognize(final @NotNull Line line, final @NotNull ProgramBuilder program) {
        final var opcode = line.first();
        if (!OPCODE_PATTERN.matcher(opcode).matches()) {
            throw new LexicalException(line.number(), "malformed opcode '%s'".formatted(opcode));
        }

        final var signature = registry.get(opcode);
        if (signature == null) {
            throw new OpcodeException(line.number(), opcode);
        }

        final var args = line.rest();
        if (args.size() != signature.arity()) {
            throw new ArityException(line.number(), signature.mnemonic(), signature.arity(), args.size());
        }

        final List<Operand> operands = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); ++i) {
            operands.add(OperandClassifier.classify(line.number(), i + 1, args.get(i), signature.operand(i)));
        }

        return program.append(signature.mnemonic(), operands);
    }
}
