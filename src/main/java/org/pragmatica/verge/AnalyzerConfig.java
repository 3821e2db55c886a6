package org.pragmatica.verge;

import org.pragmatica.verge.expression.Lexer;

/**
 * Analyzer configuration options.
 *
 * @param simplify       apply neutral/absorbing-literal identities to the tree before translation
 * @param maxInputLength longest accepted input, in characters
 */
public record AnalyzerConfig(
    boolean simplify,
    int maxInputLength
) {
    public static final AnalyzerConfig DEFAULT = new AnalyzerConfig(
        true,
        Lexer.DEFAULT_MAX_INPUT_SIZE
    );

    public AnalyzerConfig {
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, got " + maxInputLength);
        }
    }
}
