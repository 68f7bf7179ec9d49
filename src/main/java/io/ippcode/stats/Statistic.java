package io.ippcode.stats;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;

public enum Statistic implements StatsItem {

    LOC("loc", stats -> Integer.toString(stats.loc())),
    COMMENTS("comments", stats -> Integer.toString(stats.comments())),
    LABELS("labels", stats -> Integer.toString(stats.labels())),
    JUMPS("jumps", stats -> Integer.toString(stats.jumps())),
    FWJUMPS("fwjumps", stats -> Integer.toString(stats.fwjumps())),
    BACKJUMPS("backjumps", stats -> Integer.toString(stats.backjumps())),
    BADJUMPS("badjumps", stats -> Integer.toString(stats.badjumps())),
    FREQUENT("frequent", stats -> String.join(",", stats.frequent()));

    private final String name;
    private final Function<Stats, String> value;

    Statistic(final @NotNull String name, final @NotNull Function<Stats, String> value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public @NotNull String render(final @NotNull Stats stats) {
        return value.apply(stats);
    }

    public static @Nullable Statistic byName(final @NotNull String name) {
        for (final var statistic : values()) {
            if (statistic.name.equals(name)) {
                return statistic;
            }
        }
        return null;
    }
}
