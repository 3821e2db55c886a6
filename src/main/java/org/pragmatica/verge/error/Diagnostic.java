package org.pragmatica.verge.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of an {@link AnalysisError} against the analysed input.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected ')'
 *   --> input:1:6
 *    |
 *  1 | 2n + )
 *    |      ^ expected expression
 *    |
 *    = help: an operand is a number, n, a function call or a parenthesised expression
 * </pre>
 *
 * @param message Primary error message
 * @param offset  Offset of the underlined region, or {@link AnalysisError#NO_OFFSET} when the error has no position
 * @param length  Length of the underlined region
 * @param label   Text printed next to the underline
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(String message, int offset, int length, String label, List<String> notes) {

    /**
     * Build the diagnostic describing the given error.
     */
    public static Diagnostic of(AnalysisError error) {
        if (error instanceof AnalysisError.IllegalCharacter illegal) {
            return new Diagnostic("unexpected character '" + illegal.character() + "'",
                                  illegal.offset(), 1, "not part of the expression language", List.of())
                .withHelp("allowed symbols are digits, letters, + - * / ^ ( ) and whitespace");
        }
        if (error instanceof AnalysisError.MalformedNumber number) {
            return new Diagnostic("malformed number", number.offset(), number.text().length(),
                                  "not a decimal literal", List.of());
        }
        if (error instanceof AnalysisError.InputTooLong tooLong) {
            return new Diagnostic(tooLong.message(), AnalysisError.NO_OFFSET, 0, "", List.of());
        }
        if (error instanceof AnalysisError.UnexpectedToken unexpected) {
            return new Diagnostic("unexpected " + unexpected.found(), unexpected.offset(), 1,
                                  "expected " + unexpected.expected(), List.of())
                .withHelp("an operand is a number, n, a function call or a parenthesised expression");
        }
        if (error instanceof AnalysisError.UnexpectedEnd end) {
            return new Diagnostic("unexpected end of input", end.offset(), 1, "expected " + end.expected(), List.of());
        }
        if (error instanceof AnalysisError.UnmatchedParenthesis unmatched) {
            return new Diagnostic("unmatched parenthesis", unmatched.offset(), 1, "opened here", List.of())
                .withHelp("add the missing ')'");
        }
        if (error instanceof AnalysisError.UnknownFunction unknown) {
            return new Diagnostic("unknown function '" + unknown.name() + "'", unknown.offset(),
                                  unknown.name().length(), "not a reserved function name", List.of())
                .withHelp("known functions: sin, cos, tan, log, log10, log2, ln, log_e, sqrt, sqrt2, exp, e^, abs");
        }
        return new Diagnostic(error.message(), error.offset(), 1, "", List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, offset, length, label, List.copyOf(newNotes));
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against the source text.
     */
    public String format(String source) {
        var sb = new StringBuilder();
        sb.append("error: ").append(message).append("\n");

        if (offset < 0 || offset > source.length()) {
            appendNotes(sb, 1);
            return sb.toString();
        }

        // Locate the line holding the offset; input may span several lines.
        int lineStart = offset == 0
                        ? 0
                        : source.lastIndexOf('\n', offset - 1) + 1;
        int lineEnd = source.indexOf('\n', offset);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        int lineNum = 1;
        for (int i = 0; i < lineStart; i++) {
            if (source.charAt(i) == '\n') {
                lineNum++;
            }
        }
        int column = offset - lineStart + 1;
        int gutterWidth = String.valueOf(lineNum).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("--> input:").append(lineNum).append(":").append(column).append("\n");
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        sb.append(lineNum).append(" | ").append(source, lineStart, lineEnd).append("\n");
        sb.append(" ".repeat(gutterWidth)).append(" | ")
          .append(" ".repeat(column - 1))
          .append("^".repeat(Math.max(1, length)));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        sb.append("\n");
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        appendNotes(sb, gutterWidth);
        return sb.toString();
    }

    private void appendNotes(StringBuilder sb, int gutterWidth) {
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return offset < 0
               ? String.format("input: error: %s", message)
               : String.format("input:%d: error: %s", offset, message);
    }
}
