package io.ippcode.util;

import io.ippcode.error.OutputFileException;
import io.ippcode.error.UsageException;
import io.ippcode.stats.StatsGroup;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ArgContextTest {

    private static ArgContext parse(String... args) {
        var context = new ArgContext();
        context.parse(args);
        return context;
    }

    private static List<StatsGroup> groups(ArgContext context) {
        var groups = new ArrayList<StatsGroup>();
        context.getAll(groups::add);
        return groups;
    }

    @Test
    void no_arguments() {
        var context = parse();
        assertFalse(context.isHelp());
        assertFalse(context.hasStats());
    }

    @Test
    void help_alone() {
        assertTrue(parse("--help").isHelp());
        assertTrue(parse("-h").isHelp());
    }

    @Test
    void help_with_anything_else_is_usage_error() {
        var e = assertThrows(UsageException.class, () -> parse("--help", "--stats=a"));
        assertEquals(10, e.getExitCode());
        assertThrows(UsageException.class, () -> parse("--loc", "-h"));
        assertThrows(UsageException.class, () -> parse("--help", "--help"));
    }

    @Test
    void stats_groups() {
        var groups = groups(parse("--stats=a.txt", "--loc", "--eol", "--stats=b.txt", "--print=x", "--frequent"));
        assertEquals(2, groups.size());
        assertEquals("a.txt", groups.get(0).filename());
        assertEquals(2, groups.get(0).items().length);
        assertEquals("b.txt", groups.get(1).filename());
        assertEquals(2, groups.get(1).items().length);
    }

    @Test
    void empty_group() {
        var groups = groups(parse("--stats=a.txt"));
        assertEquals(1, groups.size());
        assertEquals(0, groups.get(0).items().length);
    }

    @Test
    void statistic_without_group() {
        var e = assertThrows(UsageException.class, () -> parse("--loc", "--stats=a"));
        assertEquals(10, e.getExitCode());
    }

    @Test
    void unknown_argument() {
        assertThrows(UsageException.class, () -> parse("--stats=a", "--lines"));
        assertThrows(UsageException.class, () -> parse("input.src"));
        assertThrows(UsageException.class, () -> parse("--stats="));
    }

    @Test
    void same_file_twice() {
        var e = assertThrows(OutputFileException.class, () -> parse("--stats=a", "--loc", "--stats=a"));
        assertEquals(12, e.getExitCode());
        assertEquals("a", e.getFilename());
    }
}
