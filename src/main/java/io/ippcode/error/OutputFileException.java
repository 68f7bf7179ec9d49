package io.ippcode.error;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static io.ippcode.Constants.EXIT_OUTPUT_FILE;

/**
 * A statistics output file is named twice or cannot be written.
 */
public final class OutputFileException extends ParseException {

    private final String filename;

    public OutputFileException(final @NotNull String filename, final @NotNull String message) {
        this(filename, message, null);
    }

    public OutputFileException(
            final @NotNull String filename,
            final @NotNull String message,
            final @Nullable Throwable cause
    ) {
        super(EXIT_OUTPUT_FILE, "output file '%s': %s".formatted(filename, message), cause);
        this.filename = filename;
    }

    public @NotNull String getFilename() {
        return filename;
    }
}
