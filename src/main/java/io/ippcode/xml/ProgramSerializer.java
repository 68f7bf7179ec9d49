package io.ippcode.xml;

import io.ippcode.program.Instruction;
import io.ippcode.program.Operand;
import io.ippcode.program.Program;
import org.jetbrains.annotations.NotNull;

/**
 * Maps a program to its XML document:
 * <pre>
 * &lt;program language="IPPcode24"&gt;
 *     &lt;instruction order="1" opcode="MOVE"&gt;
 *         &lt;arg1 type="var"&gt;GF@x&lt;/arg1&gt;
 * </pre>
 */
public final class ProgramSerializer {

    private ProgramSerializer() {
    }

    public static @NotNull Document serialize(final @NotNull Program program) {
        return DocumentBuilder.create()
                              .root(root -> {
                                  root.name("program").attribute("language", program.language());
                                  for (final var instruction : program.instructions()) {
                                      root.child(element -> instruction(element, instruction));
                                  }
                              })
                              .build();
    }

    private static void instruction(final @NotNull ElementBuilder element, final @NotNull Instruction instruction) {
        element.name("instruction")
               .attribute("order", instruction.order())
               .attribute("opcode", instruction.opcode());
        for (final var operand : instruction.operands()) {
            element.child(arg -> operand(arg, operand));
        }
    }

    private static void operand(final @NotNull ElementBuilder arg, final @NotNull Operand operand) {
        arg.name("arg" + operand.position())
           .attribute("type", operand.kind().label())
           .text(operand.text());
    }
}
