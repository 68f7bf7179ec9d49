package io.ippcode.parse;

import io.ippcode.program.Instruction;
import org.jetbrains.annotations.NotNull;

/**
 * Observer of a parse run. Notified in input order.
 */
public interface ParseListener {

    ParseListener NONE = new ParseListener() {
    };

    /**
     * @param line 1-based number of a line that contains a comment
     */
    default void onComment(final int line) {
    }

    default void onInstruction(final @NotNull Instruction instruction) {
    }
}
