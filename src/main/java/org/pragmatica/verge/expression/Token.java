package org.pragmatica.verge.expression;

/**
 * Token types for the expression lexer. Every token carries the offset of its first character.
 */
public sealed interface Token {
    int offset();

    // Operands
    record Number(int offset, String text, double value) implements Token {}

    record Identifier(int offset, String name) implements Token {}

    // Operators
    record Plus(int offset) implements Token {}

    // +
    record Minus(int offset) implements Token {}

    // -
    record Star(int offset) implements Token {}

    // *
    record Slash(int offset) implements Token {}

    // /
    record Caret(int offset) implements Token {}

    // ^
    // Delimiters
    record LParen(int offset) implements Token {}

    // (
    record RParen(int offset) implements Token {}

    // )
    // Special
    record Eof(int offset) implements Token {}
}
