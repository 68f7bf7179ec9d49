package io.ippcode.lex;

import io.ippcode.error.OperandException;
import io.ippcode.isa.Category;
import io.ippcode.isa.Kind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.EnumSet;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class OperandClassifierTest {

    private static final Category VAR = new Category("var", EnumSet.of(Kind.VAR));
    private static final Category SYMB =
            new Category("symb", EnumSet.of(Kind.VAR, Kind.INT, Kind.BOOL, Kind.STRING, Kind.NIL));
    private static final Category LABEL = new Category("label", EnumSet.of(Kind.LABEL));
    private static final Category TYPE = new Category("type", EnumSet.of(Kind.TYPE));

    static Stream<Arguments> accepted() {
        return Stream.of(
                Arguments.of("GF@x", SYMB, Kind.VAR, "GF@x"),
                Arguments.of("LF@_tmp-1", VAR, Kind.VAR, "LF@_tmp-1"),
                Arguments.of("TF@$&%*!?", VAR, Kind.VAR, "TF@$&%*!?"),
                Arguments.of("int@42", SYMB, Kind.INT, "42"),
                Arguments.of("int@-7", SYMB, Kind.INT, "-7"),
                Arguments.of("int@+0x1F", SYMB, Kind.INT, "+0x1F"),
                Arguments.of("int@0o17", SYMB, Kind.INT, "0o17"),
                Arguments.of("bool@true", SYMB, Kind.BOOL, "true"),
                Arguments.of("bool@false", SYMB, Kind.BOOL, "false"),
                Arguments.of("nil@nil", SYMB, Kind.NIL, "nil"),
                Arguments.of("string@", SYMB, Kind.STRING, ""),
                Arguments.of("string@ab\\032cd", SYMB, Kind.STRING, "ab cd"),
                Arguments.of("string@\\092\\035", SYMB, Kind.STRING, "\\#"),
                Arguments.of("string@a<b>&\"", SYMB, Kind.STRING, "a<b>&\""),
                Arguments.of("string@příliš", SYMB, Kind.STRING, "příliš"),
                Arguments.of("main_loop", LABEL, Kind.LABEL, "main_loop"),
                Arguments.of("int", LABEL, Kind.LABEL, "int"),
                Arguments.of("string", TYPE, Kind.TYPE, "string")
        );
    }

    @ParameterizedTest
    @MethodSource("accepted")
    void classify_accepted(String token, Category category, Kind kind, String text) {
        var operand = OperandClassifier.classify(1, 2, token, category);
        assertEquals(kind, operand.kind());
        assertEquals(text, operand.text());
        assertEquals(2, operand.position());
    }

    static Stream<Arguments> rejected() {
        return Stream.of(
                Arguments.of("XX@foo", VAR),
                Arguments.of("gf@foo", VAR),
                Arguments.of("GF@1abc", VAR),
                Arguments.of("GF@", VAR),
                Arguments.of("GF@a/b", VAR),
                Arguments.of("int@1", VAR),
                Arguments.of("int@", SYMB),
                Arguments.of("int@12a", SYMB),
                Arguments.of("int@0x", SYMB),
                Arguments.of("int@0o8", SYMB),
                Arguments.of("bool@TRUE", SYMB),
                Arguments.of("bool@1", SYMB),
                Arguments.of("nil@", SYMB),
                Arguments.of("nil@null", SYMB),
                Arguments.of("string@a\\1", SYMB),
                Arguments.of("string@a\\x41b", SYMB),
                Arguments.of("string@back\\", SYMB),
                Arguments.of("float@1.0", SYMB),
                Arguments.of("label", SYMB),
                Arguments.of("GF@x", LABEL),
                Arguments.of("1abc", LABEL),
                Arguments.of("a.b", LABEL),
                Arguments.of("float", TYPE),
                Arguments.of("nil", TYPE),
                Arguments.of("string@x", TYPE)
        );
    }

    @ParameterizedTest
    @MethodSource("rejected")
    void classify_rejected(String token, Category category) {
        var e = assertThrows(OperandException.class, () -> OperandClassifier.classify(4, 1, token, category));
        assertEquals(23, e.getExitCode());
        assertEquals(4, e.getLine());
        assertEquals(1, e.getPosition());
        assertEquals(token, e.getText());
    }

    @Test
    void decode_reaches_beyond_ascii() {
        assertEquals("ϧ", OperandClassifier.decode(1, 1, "string@\\999", "\\999"));
        assertEquals("\n", OperandClassifier.decode(1, 1, "string@\\010", "\\010"));
    }
}
