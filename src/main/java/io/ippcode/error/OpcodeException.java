package io.ippcode.error;

import org.jetbrains.annotations.NotNull;

import static io.ippcode.Constants.EXIT_OPCODE;

public final class OpcodeException extends ParseException {

    private final int line;
    private final String opcode;

    public OpcodeException(final int line, final @NotNull String opcode) {
        super(EXIT_OPCODE, "line %d: unknown opcode '%s'".formatted(line, opcode));
        this.line = line;
        this.opcode = opcode;
    }

    public int getLine() {
        return line;
    }

    public @NotNull String getOpcode() {
        return opcode;
    }
}
