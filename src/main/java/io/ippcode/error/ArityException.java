package io.ippcode.error;

import org.jetbrains.annotations.NotNull;

public final class ArityException extends LexicalException {

    private final int expected;
    private final int actual;

    public ArityException(final int line, final @NotNull String opcode, final int expected, final int actual) {
        super(line, "%s takes %d operand(s), got %d".formatted(opcode, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
