package org.pragmatica.verge.error;

/**
 * Failure raised while analysing an expression, with position information where the
 * failure can be tied to the source text.
 */
public sealed interface AnalysisError {
    int NO_OFFSET = -1;

    /**
     * Offset of the offending input, or {@link #NO_OFFSET} when the failure has no source position.
     */
    int offset();

    String message();

    /**
     * Character the lexer does not recognise.
     */
    record IllegalCharacter(int offset, char character) implements AnalysisError {
        @Override
        public String message() {
            return "Unexpected character '" + character + "' at position " + offset;
        }
    }

    /**
     * Digit/decimal-point run that is not a valid number, e.g. {@code 1.2.3}.
     */
    record MalformedNumber(int offset, String text) implements AnalysisError {
        @Override
        public String message() {
            return "Malformed number '" + text + "' at position " + offset;
        }
    }

    /**
     * Input exceeds the configured maximum length.
     */
    record InputTooLong(int length, int limit) implements AnalysisError {
        @Override
        public int offset() {
            return limit;
        }

        @Override
        public String message() {
            return "Input of " + length + " characters exceeds maximum of " + limit;
        }
    }

    /**
     * Token that does not fit the grammar at this point.
     */
    record UnexpectedToken(int offset, String found, String expected) implements AnalysisError {
        @Override
        public String message() {
            return "Unexpected " + found + " at position " + offset + ", expected " + expected;
        }
    }

    /**
     * Input ended while more was required.
     */
    record UnexpectedEnd(int offset, String expected) implements AnalysisError {
        @Override
        public String message() {
            return "Unexpected end of input at position " + offset + ", expected " + expected;
        }
    }

    /**
     * Opening parenthesis without a matching closing one.
     */
    record UnmatchedParenthesis(int offset) implements AnalysisError {
        @Override
        public String message() {
            return "Unmatched '(' at position " + offset;
        }
    }

    /**
     * Call of a name that is not a reserved function.
     */
    record UnknownFunction(int offset, String name) implements AnalysisError {
        @Override
        public String message() {
            return "Unknown function '" + name + "' at position " + offset;
        }
    }

    /**
     * Expression shape the translator cannot express, e.g. {@code n^n}.
     */
    record UnsupportedExpression(String reason) implements AnalysisError {
        @Override
        public int offset() {
            return NO_OFFSET;
        }

        @Override
        public String message() {
            return "Unsupported expression: " + reason;
        }
    }

    /**
     * Limit operation without a rule, e.g. the limit of {@code tan}.
     */
    record UnsupportedOperation(String operation) implements AnalysisError {
        @Override
        public int offset() {
            return NO_OFFSET;
        }

        @Override
        public String message() {
            return "Unsupported operation: " + operation;
        }
    }
}
