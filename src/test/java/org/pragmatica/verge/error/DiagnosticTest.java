package org.pragmatica.verge.error;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_unexpectedToken_pointsAtColumn() {
        var diagnostic = Diagnostic.of(new AnalysisError.UnexpectedToken(5, "')'", "expression"));

        var formatted = diagnostic.format("2n + )");

        assertTrue(formatted.startsWith("error: unexpected ')'\n"));
        assertTrue(formatted.contains("  --> input:1:6\n"));
        assertTrue(formatted.contains("1 | 2n + )\n"));
        assertTrue(formatted.contains("  |      ^ expected expression\n"));
        assertTrue(formatted.contains("= help: an operand is"));
    }

    @Test
    void format_unknownFunction_underlinesWholeName() {
        var formatted = Diagnostic.of(new AnalysisError.UnknownFunction(4, "foo")).format("1 + foo(n)");

        assertTrue(formatted.contains("  |     ^^^ not a reserved function name\n"));
        assertTrue(formatted.contains("known functions: sin"));
    }

    @Test
    void format_secondLine_lineAndColumnFromLineStart() {
        var formatted = Diagnostic.of(new AnalysisError.IllegalCharacter(5, '$')).format("n +\n1$");

        assertTrue(formatted.contains("--> input:2:2\n"));
        assertTrue(formatted.contains("2 | 1$\n"));
    }

    @Test
    void format_offsetAtStart_firstColumn() {
        var formatted = Diagnostic.of(new AnalysisError.UnexpectedEnd(0, "expression")).format("");

        assertTrue(formatted.contains("--> input:1:1\n"));
    }

    @Test
    void format_withoutPosition_headerAndNotesOnly() {
        var diagnostic = Diagnostic.of(new AnalysisError.UnsupportedExpression("n^n"))
                                   .withNote("only constant bases take variable exponents");

        var formatted = diagnostic.format("n^n");

        assertEquals("error: Unsupported expression: n^n\n  = only constant bases take variable exponents\n", formatted);
    }

    @Test
    void withHelp_prefixesNote() {
        var diagnostic = new Diagnostic("message", 0, 1, "", List.of()).withHelp("try this");

        assertEquals(List.of("help: try this"), diagnostic.notes());
    }

    @Test
    void formatSimple_includesOffsetWhenKnown() {
        assertEquals("input:3: error: unmatched parenthesis",
                     Diagnostic.of(new AnalysisError.UnmatchedParenthesis(3)).formatSimple());
        assertEquals("input: error: Unsupported operation: tan",
                     Diagnostic.of(new AnalysisError.UnsupportedOperation("tan")).formatSimple());
    }

    @Test
    void of_errorWithoutPosition_noOffset() {
        assertEquals(AnalysisError.NO_OFFSET, new AnalysisError.UnsupportedExpression("n^n").offset());
        assertEquals(AnalysisError.NO_OFFSET, Diagnostic.of(new AnalysisError.UnsupportedOperation("tan")).offset());
        assertEquals(AnalysisError.NO_OFFSET, Diagnostic.of(new AnalysisError.InputTooLong(5, 3)).offset());
    }

    @Test
    void exception_format_delegatesToDiagnostic() {
        var exception = new AnalysisException(new AnalysisError.UnmatchedParenthesis(0));

        assertEquals("Unmatched '(' at position 0", exception.getMessage());
        assertTrue(exception.format("(n").contains("^ opened here"));
    }
}
