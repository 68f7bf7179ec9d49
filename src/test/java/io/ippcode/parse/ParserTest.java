package io.ippcode.parse;

import io.ippcode.error.ArityException;
import io.ippcode.error.HeaderException;
import io.ippcode.error.LexicalException;
import io.ippcode.error.OpcodeException;
import io.ippcode.error.OperandException;
import io.ippcode.isa.Kind;
import io.ippcode.isa.Registry;
import io.ippcode.program.Instruction;
import io.ippcode.program.Program;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static final Registry REGISTRY = Registry.load();

    private static Program parse(String src) {
        return parse(src, ParseListener.NONE);
    }

    private static Program parse(String src, ParseListener listener) {
        return new Parser(REGISTRY, listener).parse(new ByteArrayInputStream(src.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void parse_simple_program() {
        var program = parse("""
                .IPPcode24
                DEFVAR GF@counter
                MOVE GF@counter string@
                LABEL while
                JUMPIFEQ end GF@counter string@aaa
                WRITE GF@counter
                CONCAT GF@counter GF@counter string@a
                JUMP while
                LABEL end
                """);
        assertEquals("IPPcode24", program.language());
        assertEquals(8, program.size());

        var jump = program.instruction(3);
        assertEquals(4, jump.order());
        assertEquals("JUMPIFEQ", jump.opcode());
        assertEquals(Kind.LABEL, jump.operand(0).kind());
        assertEquals("end", jump.operand(0).text());
        assertEquals(Kind.VAR, jump.operand(1).kind());
        assertEquals(Kind.STRING, jump.operand(2).kind());
        assertEquals("aaa", jump.operand(2).text());
    }

    @Test
    void order_is_contiguous_across_blank_and_comment_lines() {
        var program = parse("""
                # leading comment
                .ippcode24 # header comment

                CREATEFRAME
                # inner comment

                PUSHFRAME   # push
                \t
                POPFRAME
                """);
        assertEquals(3, program.size());
        for (int i = 0; i < program.size(); ++i) {
            assertEquals(i + 1, program.instruction(i).order());
        }
    }

    @Test
    void opcode_and_header_are_case_insensitive() {
        var upper = parse(".IPPCODE24\nMOVE GF@a int@1\nread GF@b bool\n");
        var mixed = parse(".IppCode24\nmOvE GF@a int@1\nREAD GF@b bool\n");
        assertEquals(upper, mixed);
        assertEquals("READ", mixed.instruction(1).opcode());
        assertEquals(Kind.TYPE, mixed.instruction(1).operand(1).kind());
    }

    @Test
    void empty_program() {
        assertEquals(0, parse(".IPPcode24\n").size());
        assertEquals(0, parse(".IPPcode24").size());
    }

    @Test
    void listener_sees_instructions_and_comments_in_order() {
        var seen = new ArrayList<String>();
        parse("#a\n.IPPcode24\nBREAK #b\n#c\nRETURN\n", new ParseListener() {
            @Override
            public void onComment(int line) {
                seen.add("#" + line);
            }

            @Override
            public void onInstruction(Instruction instruction) {
                seen.add(instruction.opcode());
            }
        });
        assertEquals(List.of("#1", "#3", "BREAK", "#4", "RETURN"), seen);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "\n\n   \n",
            "# only comments\n",
            "WRITE int@1\n",
            ".IPPcode23\n",
            "IPPcode24\n",
            ".IPPcode24 BREAK\n",
            ".IPPcode24x\n",
    })
    void missing_or_invalid_header(String src) {
        var e = assertThrows(HeaderException.class, () -> parse(src));
        assertEquals(21, e.getExitCode());
    }

    @Test
    void unknown_opcode() {
        var e = assertThrows(OpcodeException.class, () -> parse(".IPPcode24\nBREAK\nNOP\n"));
        assertEquals(22, e.getExitCode());
        assertEquals(3, e.getLine());
        assertEquals("NOP", e.getOpcode());
    }

    @Test
    void malformed_opcode_is_lexical_error() {
        var e = assertThrows(LexicalException.class, () -> parse(".IPPcode24\nMO@VE GF@a GF@b\n"));
        assertEquals(23, e.getExitCode());
    }

    @Test
    void wrong_arity() {
        var e = assertThrows(ArityException.class, () -> parse(".IPPcode24\nMOVE GF@a\n"));
        assertEquals(23, e.getExitCode());
        assertEquals(2, e.getExpected());
        assertEquals(1, e.getActual());

        assertThrows(ArityException.class, () -> parse(".IPPcode24\nBREAK GF@a\n"));
        assertThrows(ArityException.class, () -> parse(".IPPcode24\nNOT GF@a GF@b GF@c\n"));
    }

    @Test
    void arity_checked_before_operands() {
        assertThrows(ArityException.class, () -> parse(".IPPcode24\nADD XX@a int@x\n"));
    }

    @Test
    void malformed_variable() {
        var e = assertThrows(OperandException.class, () -> parse(".IPPcode24\nDEFVAR XX@foo\n"));
        assertEquals(23, e.getExitCode());
        assertEquals(1, e.getPosition());
        assertEquals("XX@foo", e.getText());
    }

    @Test
    void first_bad_operand_reported() {
        var e = assertThrows(OperandException.class, () -> parse(".IPPcode24\nADD GF@a int@x bool@y\n"));
        assertEquals(2, e.getPosition());
    }

    @Test
    void first_bad_line_aborts() {
        var e = assertThrows(OperandException.class, () -> parse(".IPPcode24\nPUSHS int@\nFOO\n"));
        assertEquals(2, e.getLine());
    }
}
