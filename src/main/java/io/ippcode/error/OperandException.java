package io.ippcode.error;

import org.jetbrains.annotations.NotNull;

public final class OperandException extends LexicalException {

    private final int position;
    private final String text;

    public OperandException(final int line, final int position, final @NotNull String text, final @NotNull String reason) {
        super(line, "operand %d '%s': %s".formatted(position, text, reason));
        this.position = position;
        this.text = text;
    }

    public int getPosition() {
        return position;
    }

    public @NotNull String getText() {
        return text;
    }
}
