package io.ippcode.util;

import com.carrotsearch.hppc.ObjectArrayList;
import com.carrotsearch.hppc.ObjectHashSet;
import com.carrotsearch.hppc.ObjectIndexedContainer;
import com.carrotsearch.hppc.ObjectSet;
import io.ippcode.error.OutputFileException;
import io.ippcode.error.UsageException;
import io.ippcode.stats.Statistic;
import io.ippcode.stats.StatsGroup;
import io.ippcode.stats.StatsItem;
import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Command line of the parser. Accepts either a lone help flag or a sequence of
 * statistics groups, each opened by {@code --stats=FILE}.
 */
public class ArgContext {

    private static final Set<String> help = Set.of("--help", "-h");

    private static final String STATS = "--stats=";
    private static final String PRINT = "--print=";
    private static final String EOL = "--eol";

    private final ObjectIndexedContainer<StatsGroup> groups = new ObjectArrayList<>();
    private boolean helpRequested;

    public ArgContext() {
    }

    public void parse(final @NotNull String @NotNull [] args) {
        for (final var arg : args) {
            if (help.contains(arg)) {
                if (args.length > 1) {
                    throw new UsageException("'%s' can't be combined with other arguments", arg);
                }
                helpRequested = true;
                return;
            }
        }

        final ObjectSet<String> files = new ObjectHashSet<>();

        String filename = null;
        ObjectArrayList<StatsItem> items = null;

        for (final var arg : args) {
            if (arg.startsWith(STATS)) {
                if (filename != null) {
                    groups.add(new StatsGroup(filename, items.toArray(StatsItem.class)));
                }
                filename = arg.substring(STATS.length());
                if (filename.isEmpty()) {
                    throw new UsageException("missing file name in '%s'", arg);
                }
                if (!files.add(filename)) {
                    throw new OutputFileException(filename, "used by more than one statistics group");
                }
                items = new ObjectArrayList<>();
                continue;
            }

            final var item = item(arg);
            if (items == null) {
                throw new UsageException("'%s' must follow a '%sFILE' argument", arg, STATS);
            }
            items.add(item);
        }

        if (filename != null) {
            groups.add(new StatsGroup(filename, items.toArray(StatsItem.class)));
        }
    }

    private static @NotNull StatsItem item(final @NotNull String arg) {
        if (arg.startsWith(PRINT)) {
            return StatsItem.text(arg.substring(PRINT.length()));
        }
        if (arg.equals(EOL)) {
            return StatsItem.text("");
        }
        if (arg.startsWith("--")) {
            final var statistic = Statistic.byName(arg.substring(2));
            if (statistic != null) {
                return statistic;
            }
        }
        throw new UsageException("unknown argument '%s'", arg);
    }

    public boolean isHelp() {
        return helpRequested;
    }

    public boolean hasStats() {
        return !groups.isEmpty();
    }

    public void getAll(final @NotNull Consumer<StatsGroup> action) {
        for (final var group : groups) {
            action.accept(group.value);
        }
    }

    public static @NotNull String usage() {
        return """
                Usage: parse [--help] [--stats=FILE [STAT]...]...

                Reads an IPPcode24 program from standard input and writes its XML
                representation to standard output.

                  -h, --help         print this help and exit; takes no other argument
                  --stats=FILE       start a statistics group written to FILE
                  --loc              number of instructions
                  --comments         number of lines with a comment
                  --labels           number of distinct labels
                  --jumps            number of jump, call and return instructions
                  --fwjumps          number of forward jumps
                  --backjumps        number of backward jumps
                  --badjumps         number of jumps to undefined labels
                  --frequent         most frequent opcodes, comma separated
                  --print=STRING     write STRING
                  --eol              write an empty line
                """;
    }
}
