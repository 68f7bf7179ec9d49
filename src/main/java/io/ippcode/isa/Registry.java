package io.ippcode.isa;

import com.carrotsearch.hppc.ObjectObjectHashMap;
import com.carrotsearch.hppc.ObjectObjectMap;
import io.ippcode.util.Log;
import io.ippcode.util.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.ippcode.Constants.SIGNATURE_TABLE;
import static java.util.function.Predicate.not;

/**
 * Signature table: maps every opcode to its operand categories. The table is
 * data, read from a classpath resource of the form
 * <pre>
 * type symb var int bool string nil
 * MOVE var symb
 * </pre>
 * and never changes after it was loaded.
 */
public final class Registry {

    private static final Pattern TYPE_PATTERN =
            Pattern.compile("^type\\s+(\\w+)\\s+(.+)$");
    private static final Pattern INSTRUCTION_PATTERN =
            Pattern.compile("^([A-Za-z0-9]+)((?:\\s+\\w+)*)$");

    private final ObjectObjectMap<String, Category> categories = new ObjectObjectHashMap<>();
    private final ObjectObjectMap<String, Signature> signatures = new ObjectObjectHashMap<>();

    private Registry() {
    }

    /**
     * Load the built-in instruction set from the classpath.
     */
    public static @NotNull Registry load() {
        final var registry = new Registry();
        Resource.read(SIGNATURE_TABLE, registry::parse);
        Log.info("loaded %d instruction signatures from '%s'", registry.size(), SIGNATURE_TABLE);
        return registry;
    }

    public static @NotNull Registry parse(final @NotNull String name, final @NotNull InputStream stream) {
        final var registry = new Registry();
        registry.parse(stream);
        Log.info("loaded %d instruction signatures from '%s'", registry.size(), name);
        return registry;
    }

    private void parse(final @NotNull InputStream stream) {
        final var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        reader.lines()
              .map(String::trim)
              .filter(not(String::isEmpty))
              .filter(not(line -> line.startsWith("#")))
              .forEach(this::parse);
    }

    private void parse(final @NotNull String line) {

        final var mType = TYPE_PATTERN.matcher(line);
        if (mType.matches()) {
            final var category = parseCategory(mType);
            categories.put(category.label(), category);
            return;
        }

        final var mInstruction = INSTRUCTION_PATTERN.matcher(line);
        if (mInstruction.matches()) {
            final var signature = parseSignature(categories, mInstruction);
            if (signatures.containsKey(signature.mnemonic())) {
                throw new IllegalArgumentException("duplicate signature for '%s'".formatted(signature.mnemonic()));
            }
            signatures.put(signature.mnemonic(), signature);
            return;
        }

        Log.warn("unhandled line pattern '%s'", line);
    }

    private static @NotNull Category parseCategory(final @NotNull Matcher mType) {
        final var kinds = EnumSet.noneOf(Kind.class);

        for (final var token : mType.group(2).trim().split("\\s+")) {
            final var kind = Kind.byLabel(token);
            if (kind == null) {
                throw new IllegalArgumentException("invalid operand kind '%s'".formatted(token));
            }
            kinds.add(kind);
        }

        return new Category(mType.group(1), kinds);
    }

    private static @NotNull Signature parseSignature(
            final @NotNull ObjectObjectMap<String, Category> categories,
            final @NotNull Matcher mInstruction
    ) {
        final List<Category> operands = new ArrayList<>();

        for (final var token : mInstruction.group(2).trim().split("\\s+")) {
            if (token.isBlank()) {
                continue;
            }
            if (!categories.containsKey(token)) {
                throw new IllegalArgumentException("invalid category '%s'".formatted(token));
            }
            operands.add(categories.get(token));
        }

        return new Signature(mInstruction.group(1).toUpperCase(Locale.ROOT), operands.toArray(Category[]::new));
    }

    /**
     * @param opcode mnemonic in any letter case
     * @return the signature, or {@code null} if the opcode is not part of the instruction set
     */
    public @Nullable Signature get(final @NotNull String opcode) {
        return signatures.get(opcode.toUpperCase(Locale.ROOT));
    }

    public int size() {
        return signatures.size();
    }
}
