package org.pragmatica.verge.expression;

import org.junit.jupiter.api.Test;
import org.pragmatica.verge.error.AnalysisError;
import org.pragmatica.verge.error.AnalysisException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test
    void tokenize_numberAndIdentifier_splitsAtLetter() {
        var tokens = Lexer.tokenize("2n+5");

        assertEquals(List.of(new Token.Number(0, "2", 2),
                             new Token.Identifier(1, "n"),
                             new Token.Plus(2),
                             new Token.Number(3, "5", 5),
                             new Token.Eof(4)),
                     tokens);
    }

    @Test
    void tokenize_whitespace_skippedButOffsetsKept() {
        var tokens = Lexer.tokenize(" n  ^ 2");

        assertEquals(List.of(new Token.Identifier(1, "n"),
                             new Token.Caret(4),
                             new Token.Number(6, "2", 2),
                             new Token.Eof(7)),
                     tokens);
    }

    @Test
    void tokenize_allOperators_recognised() {
        var tokens = Lexer.tokenize("+-*/^()");

        assertInstanceOf(Token.Plus.class, tokens.get(0));
        assertInstanceOf(Token.Minus.class, tokens.get(1));
        assertInstanceOf(Token.Star.class, tokens.get(2));
        assertInstanceOf(Token.Slash.class, tokens.get(3));
        assertInstanceOf(Token.Caret.class, tokens.get(4));
        assertInstanceOf(Token.LParen.class, tokens.get(5));
        assertInstanceOf(Token.RParen.class, tokens.get(6));
        assertInstanceOf(Token.Eof.class, tokens.get(7));
    }

    @Test
    void tokenize_decimals_parsedAsDouble() {
        var tokens = Lexer.tokenize("0.25 .5");

        assertEquals(0.25, ((Token.Number) tokens.get(0)).value());
        assertEquals(0.5, ((Token.Number) tokens.get(1)).value());
    }

    @Test
    void tokenize_identifierWithDigitsAndUnderscore_singleToken() {
        var tokens = Lexer.tokenize("log_e log10 SIN");

        assertEquals(new Token.Identifier(0, "log_e"), tokens.get(0));
        assertEquals(new Token.Identifier(6, "log10"), tokens.get(1));
        assertEquals(new Token.Identifier(12, "SIN"), tokens.get(2));
    }

    @Test
    void tokenize_emptyInput_onlyEof() {
        assertEquals(List.of(new Token.Eof(0)), Lexer.tokenize(""));
    }

    // === Errors ===

    @Test
    void tokenize_illegalCharacter_reportsCharacterAndOffset() {
        var exception = assertThrows(AnalysisException.class, () -> Lexer.tokenize("2 $ n"));

        assertEquals(new AnalysisError.IllegalCharacter(2, '$'), exception.error());
        assertTrue(exception.getMessage().contains("'$'"));
    }

    @Test
    void tokenize_twoDecimalPoints_malformedNumber() {
        var exception = assertThrows(AnalysisException.class, () -> Lexer.tokenize("n + 1.2.3"));

        assertEquals(new AnalysisError.MalformedNumber(4, "1.2.3"), exception.error());
    }

    @Test
    void tokenize_loneDecimalPoint_malformedNumber() {
        var exception = assertThrows(AnalysisException.class, () -> Lexer.tokenize("."));

        assertInstanceOf(AnalysisError.MalformedNumber.class, exception.error());
    }

    @Test
    void tokenize_inputOverLimit_rejected() {
        var exception = assertThrows(AnalysisException.class, () -> Lexer.tokenize("n+n+n", 3));

        assertEquals(new AnalysisError.InputTooLong(5, 3), exception.error());
    }
}
