package io.ippcode.lex;

import io.ippcode.error.OperandException;
import io.ippcode.isa.Category;
import io.ippcode.isa.Kind;
import io.ippcode.program.Operand;
import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides the kind of a raw operand token and validates its lexical form.
 * <p>
 * Tokens containing {@code @} are variables ({@code GF|LF|TF}) or constants
 * ({@code int|bool|string|nil}), tested in that order. Bare words are type
 * names where the slot accepts types and labels otherwise.
 */
public final class OperandClassifier {

    private static final String IDENTIFIER = "[A-Za-z_\\-$&%*!?][A-Za-z0-9_\\-$&%*!?]*";

    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile("^" + IDENTIFIER + "$");
    private static final Pattern VAR_PATTERN =
            Pattern.compile("^(GF|LF|TF)@(.*)$");
    private static final Pattern CONST_PATTERN =
            Pattern.compile("^(int|bool|string|nil)@(.*)$");
    private static final Pattern INT_PATTERN =
            Pattern.compile("^[+-]?(?:0x[0-9a-fA-F]+|0o[0-7]+|[0-9]+)$");

    private static final Set<String> TYPE_NAMES = Set.of("int", "bool", "string");

    private OperandClassifier() {
    }

    /**
     * @param line     input line, for diagnostics
     * @param position 1-based operand position
     * @param token    raw operand text
     * @param category kinds accepted at this position
     * @return the classified operand
     * @throws OperandException if the token is malformed or of a kind the slot does not accept
     */
    public static @NotNull Operand classify(
            final int line,
            final int position,
            final @NotNull String token,
            final @NotNull Category category
    ) {
        final var operand = classify(line, position, token, category.accepts(Kind.TYPE));
        if (!category.accepts(operand.kind())) {
            throw new OperandException(line,
                                       position,
                                       token,
                                       "%s not allowed here, expected <%s>".formatted(operand.kind().label(),
                                                                                     category.label()));
        }
        return operand;
    }

    private static @NotNull Operand classify(
            final int line,
            final int position,
            final @NotNull String token,
            final boolean typeExpected
    ) {
        final var mVar = VAR_PATTERN.matcher(token);
        if (mVar.matches()) {
            if (!IDENTIFIER_PATTERN.matcher(mVar.group(2)).matches()) {
                throw new OperandException(line, position, token, "invalid variable name");
            }
            return new Operand(Kind.VAR, token, position);
        }

        final var mConst = CONST_PATTERN.matcher(token);
        if (mConst.matches()) {
            final var kind  = Kind.byLabel(mConst.group(1));
            final var value = mConst.group(2);
            if (kind == null) {
                throw new IllegalStateException("constant pattern admits unknown type '%s'".formatted(mConst.group(1)));
            }
            return new Operand(kind, constant(line, position, token, kind, value), position);
        }

        if (token.indexOf('@') >= 0) {
            throw new OperandException(line, position, token, "unknown frame or type prefix");
        }

        if (typeExpected && TYPE_NAMES.contains(token)) {
            return new Operand(Kind.TYPE, token, position);
        }

        if (IDENTIFIER_PATTERN.matcher(token).matches()) {
            return new Operand(Kind.LABEL, token, position);
        }

        throw new OperandException(line, position, token, "invalid identifier");
    }

    private static @NotNull String constant(
            final int line,
            final int position,
            final @NotNull String token,
            final @NotNull Kind kind,
            final @NotNull String value
    ) {
        return switch (kind) {
            case INT -> {
                if (!INT_PATTERN.matcher(value).matches()) {
                    throw new OperandException(line, position, token, "invalid integer literal");
                }
                yield value;
            }
            case BOOL -> {
                if (!value.equals("true") && !value.equals("false")) {
                    throw new OperandException(line, position, token, "bool must be 'true' or 'false'");
                }
                yield value;
            }
            case NIL -> {
                if (!value.equals("nil")) {
                    throw new OperandException(line, position, token, "nil must be 'nil'");
                }
                yield value;
            }
            case STRING -> decode(line, position, token, value);
            default -> throw new IllegalStateException("not a constant kind: %s".formatted(kind));
        };
    }

    /**
     * Replace every escape {@code \ddd} by the character with decimal code {@code ddd}.
     */
    static @NotNull String decode(
            final int line,
            final int position,
            final @NotNull String token,
            final @NotNull String value
    ) {
        final var builder = new StringBuilder(value.length());

        for (int i = 0; i < value.length(); ++i) {
            final var c = value.charAt(i);

            if (Character.isWhitespace(c) || c == LineTokenizer.COMMENT) {
                throw new OperandException(line, position, token, "unescaped character %d in string".formatted((int) c));
            }

            if (c != '\\') {
                builder.append(c);
                continue;
            }

            if (i + 3 >= value.length()) {
                throw new OperandException(line, position, token, "incomplete escape sequence at offset %d".formatted(i));
            }

            int code = 0;
            for (int j = 1; j <= 3; ++j) {
                final var d = value.charAt(i + j);
                if (d < '0' || d > '9') {
                    throw new OperandException(line, position, token, "invalid escape sequence at offset %d".formatted(i));
                }
                code = code * 10 + (d - '0');
            }

            builder.appendCodePoint(code);
            i += 3;
        }

        return builder.toString();
    }
}
