package io.ippcode.lex;

import io.ippcode.error.InternalException;
import io.ippcode.error.LexicalException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Splits source text into lines of tokens. Everything from the first {@code #}
 * to the end of a line is a comment; lines left without tokens are skipped.
 * <p>
 * Input is split on {@code '\n'} as raw bytes and every line is decoded as
 * strict UTF-8 on its own, so malformed input is reported with its own line
 * number and only once that line is reached.
 */
public final class LineTokenizer {

    public static final char COMMENT = '#';

    private static final int NEWLINE = '\n';

    private final InputStream stream;
    private final IntConsumer comments;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private int number;
    private boolean eof;

    public LineTokenizer(final @NotNull InputStream stream, final @NotNull IntConsumer comments) {
        this.stream = stream;
        this.comments = comments;
    }

    public static @NotNull LineTokenizer of(final @NotNull InputStream stream, final @NotNull IntConsumer comments) {
        return new LineTokenizer(new BufferedInputStream(stream), comments);
    }

    /**
     * @return the next line with at least one token, or {@code null} at end of input
     */
    public @Nullable Line next() {
        byte[] bytes;
        while ((bytes = readLine()) != null) {
            ++number;

            final var raw    = decode(bytes);
            final var tokens = tokenize(raw, () -> comments.accept(number));
            if (!tokens.isEmpty()) {
                return new Line(number, tokens);
            }
        }
        return null;
    }

    private byte @Nullable [] readLine() {
        if (eof) {
            return null;
        }

        buffer.reset();
        try {
            int b;
            while ((b = stream.read()) >= 0) {
                if (b == NEWLINE) {
                    return buffer.toByteArray();
                }
                buffer.write(b);
            }
        } catch (final IOException e) {
            throw new InternalException("failed to read input", e);
        }

        eof = true;
        return buffer.size() == 0 ? null : buffer.toByteArray();
    }

    private @NotNull String decode(final byte @NotNull [] bytes) {
        final var decoder = StandardCharsets.UTF_8.newDecoder()
                                                  .onMalformedInput(CodingErrorAction.REPORT)
                                                  .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (final CharacterCodingException e) {
            throw new LexicalException(number, "input is not valid UTF-8", e);
        }
    }

    public static @NotNull List<String> tokenize(final @NotNull String line) {
        return tokenize(line, () -> {
        });
    }

    private static @NotNull List<String> tokenize(final @NotNull String line, final @NotNull Runnable comment) {
        final List<String> tokens = new ArrayList<>();

        var state = State.SPACE;
        var start = 0;

        for (int i = 0; i < line.length(); ++i) {
            final var c = line.charAt(i);

            if (c == COMMENT) {
                comment.run();
                break;
            }

            switch (state) {
                case SPACE -> {
                    if (!isSpace(c)) {
                        state = State.TOKEN;
                        start = i;
                    }
                }
                case TOKEN -> {
                    if (isSpace(c)) {
                        state = State.SPACE;
                        tokens.add(line.substring(start, i));
                    }
                }
            }
        }

        if (state == State.TOKEN) {
            final var end = line.indexOf(COMMENT);
            tokens.add(line.substring(start, end < 0 ? line.length() : end));
        }

        return tokens;
    }

    private static boolean isSpace(final char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == 0x0B;
    }

    private enum State {
        SPACE,
        TOKEN,
    }
}
