package io.ippcode.stats;

import com.carrotsearch.hppc.ObjectHashSet;
import com.carrotsearch.hppc.ObjectIntHashMap;
import com.carrotsearch.hppc.ObjectIntMap;
import com.carrotsearch.hppc.ObjectSet;
import com.carrotsearch.hppc.cursors.ObjectIntCursor;
import io.ippcode.parse.ParseListener;
import io.ippcode.program.Instruction;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Source statistics gathered while parsing.
 * <p>
 * A jump to a label that is already defined counts as a backward jump. A jump to
 * a label not yet defined stays pending; defining the label later turns every
 * pending jump to it into a forward jump. Jumps still pending at the end are
 * bad jumps.
 */
public final class Stats implements ParseListener {

    private static final Set<String> JUMPS = Set.of("JUMP", "JUMPIFEQ", "JUMPIFNEQ", "CALL");

    private int loc;
    private int comments;
    private int jumps;
    private int fwjumps;
    private int backjumps;

    private final ObjectSet<String> labels = new ObjectHashSet<>();
    private final ObjectIntMap<String> pending = new ObjectIntHashMap<>();
    private final ObjectIntMap<String> opcodes = new ObjectIntHashMap<>();

    @Override
    public void onComment(final int line) {
        ++comments;
    }

    @Override
    public void onInstruction(final @NotNull Instruction instruction) {
        ++loc;

        final var opcode = instruction.opcode();
        opcodes.addTo(opcode, 1);

        if (opcode.equals("LABEL")) {
            final var label = instruction.operand(0).text();
            if (labels.add(label)) {
                fwjumps += pending.remove(label);
            }
            return;
        }

        if (opcode.equals("RETURN")) {
            ++jumps;
            return;
        }

        if (JUMPS.contains(opcode)) {
            ++jumps;
            final var label = instruction.operand(0).text();
            if (labels.contains(label)) {
                ++backjumps;
            } else {
                pending.addTo(label, 1);
            }
        }
    }

    public int loc() {
        return loc;
    }

    public int comments() {
        return comments;
    }

    public int labels() {
        return labels.size();
    }

    public int jumps() {
        return jumps;
    }

    public int fwjumps() {
        return fwjumps;
    }

    public int backjumps() {
        return backjumps;
    }

    public int badjumps() {
        int count = 0;
        for (final ObjectIntCursor<String> cursor : pending) {
            count += cursor.value;
        }
        return count;
    }

    /**
     * @return the most frequent opcodes in alphabetical order, empty if there were no instructions
     */
    public @NotNull List<String> frequent() {
        int max = 0;
        for (final ObjectIntCursor<String> cursor : opcodes) {
            max = Math.max(max, cursor.value);
        }

        final List<String> result = new ArrayList<>();
        for (final ObjectIntCursor<String> cursor : opcodes) {
            if (cursor.value == max) {
                result.add(cursor.key);
            }
        }
        Collections.sort(result);
        return result;
    }
}
