package io.ippcode.stats;

import io.ippcode.error.OutputFileException;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Statistics requested for one output file, in command line order.
 */
public record StatsGroup(@NotNull String filename, @NotNull StatsItem @NotNull [] items) {

    public void write(final @NotNull Stats stats, final @NotNull Writer writer) throws IOException {
        for (final var item : items) {
            writer.write(item.render(stats));
            writer.write('\n');
        }
    }

    public void write(final @NotNull Stats stats) {
        try (final var writer = Files.newBufferedWriter(Path.of(filename), StandardCharsets.UTF_8)) {
            write(stats, writer);
        } catch (final IOException | InvalidPathException e) {
            throw new OutputFileException(filename, "cannot write statistics", e);
        }
    }
}
