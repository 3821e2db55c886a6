package org.pragmatica.verge.expression;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reserved function names, matched case-insensitively.
 */
public enum FunctionName {
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    LOG10("log", "log10"),
    LOG2("log2"),
    LN("ln", "log_e"),
    SQRT("sqrt", "sqrt2"),
    EXP("exp", "e^"),
    // Identity, not a true absolute value
    ABS("abs");

    private final List<String> spellings;

    FunctionName(String... spellings) {
        this.spellings = List.of(spellings);
    }

    public static Optional<FunctionName> lookup(String name) {
        var lower = name.toLowerCase(Locale.ROOT);
        for (var function : values()) {
            if (function.spellings.contains(lower)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
