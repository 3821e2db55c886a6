package org.pragmatica.verge.expression;

import org.pragmatica.verge.error.AnalysisError;
import org.pragmatica.verge.error.AnalysisException;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for sequence expressions.
 */
public final class Lexer {
    public static final int DEFAULT_MAX_INPUT_SIZE = 10_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
    }

    public static List<Token> tokenize(String input) {
        return tokenize(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static List<Token> tokenize(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw new AnalysisException(new AnalysisError.InputTooLong(input.length(), maxInputSize));
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            skipWhitespace();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new Token.Eof(pos));
        return tokens;
    }

    private Token nextToken() {
        int start = pos;
        char c = peek();
        if (isDigit(c) || c == '.') {
            return scanNumber(start);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        return scanOperator(start);
    }

    private Token scanNumber(int start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && (isDigit(peek()) || peek() == '.')) {
            sb.append(advance());
        }
        var text = sb.toString();
        if (!isWellFormed(text)) {
            throw new AnalysisException(new AnalysisError.MalformedNumber(start, text));
        }
        return new Token.Number(start, text, Double.parseDouble(text));
    }

    private Token scanIdentifier(int start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token.Identifier(start, sb.toString());
    }

    private Token scanOperator(int start) {
        char c = advance();
        return switch (c) {
            case '+' -> new Token.Plus(start);
            case '-' -> new Token.Minus(start);
            case '*' -> new Token.Star(start);
            case '/' -> new Token.Slash(start);
            case '^' -> new Token.Caret(start);
            case '(' -> new Token.LParen(start);
            case ')' -> new Token.RParen(start);
            default -> throw new AnalysisException(new AnalysisError.IllegalCharacter(start, c));
        };
    }

    // At most one decimal point and at least one digit
    private static boolean isWellFormed(String text) {
        int points = 0;
        int digits = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '.') {
                points++ ;
            }else {
                digits++ ;
            }
        }
        return points <= 1 && digits > 0;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++ );
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
