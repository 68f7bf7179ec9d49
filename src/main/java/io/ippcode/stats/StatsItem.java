package io.ippcode.stats;

import org.jetbrains.annotations.NotNull;

/**
 * One line of a statistics file.
 */
@FunctionalInterface
public interface StatsItem {

    @NotNull String render(final @NotNull Stats stats);

    static @NotNull StatsItem text(final @NotNull String text) {
        return stats -> text;
    }
}
