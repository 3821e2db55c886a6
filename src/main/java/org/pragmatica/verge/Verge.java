package org.pragmatica.verge;

import org.pragmatica.verge.expression.Expression;
import org.pragmatica.verge.expression.ExpressionParser;
import org.pragmatica.verge.expression.Expressions;
import org.pragmatica.verge.expression.Lexer;
import org.pragmatica.verge.function.AsymptoticFunction;
import org.pragmatica.verge.function.FunctionTranslator;
import org.pragmatica.verge.limit.ConvergenceResult;
import org.pragmatica.verge.limit.LimitEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for classifying the limit of a sequence in n.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = Verge.create().analyze("(2n+1)/(3n+2)");
 * result.converges();          // true
 * result.limit().getAsDouble(); // 0.666...
 * }</pre>
 *
 * <p>Every stage fails fast with {@link org.pragmatica.verge.error.AnalysisException}.
 * Instances are immutable and safe to share between threads.
 */
public final class Verge {
    private static final Logger log = LoggerFactory.getLogger(Verge.class);

    private final AnalyzerConfig config;

    private Verge(AnalyzerConfig config) {
        this.config = config;
    }

    /**
     * Create an analyzer with default configuration.
     */
    public static Verge create() {
        return new Verge(AnalyzerConfig.DEFAULT);
    }

    /**
     * Create an analyzer with custom configuration.
     */
    public static Verge create(AnalyzerConfig config) {
        return new Verge(config);
    }

    public AnalyzerConfig config() {
        return config;
    }

    /**
     * Parse text into an expression tree, without translating it.
     */
    public Expression parseExpression(String text) {
        return ExpressionParser.parse(Lexer.tokenize(text, config.maxInputLength()));
    }

    /**
     * Translate an expression tree into its asymptotic function.
     */
    public AsymptoticFunction parseFunction(Expression expression) {
        return FunctionTranslator.parseFunction(expression);
    }

    /**
     * Classify the limit of an asymptotic function.
     */
    public ConvergenceResult converge(AsymptoticFunction function) {
        return LimitEvaluator.converge(function);
    }

    /**
     * Run the whole pipeline: parse, optionally simplify, translate and classify.
     */
    public ConvergenceResult analyze(String text) {
        log.debug("Analyzing '{}'", text);
        var expression = parseExpression(text);
        if (config.simplify()) {
            expression = Expressions.simplify(expression);
        }
        if (log.isDebugEnabled()) {
            log.debug("Parsed as {}", Expressions.render(expression));
        }
        var function = parseFunction(expression);
        log.debug("Translated to {}", function);
        var result = converge(function);
        log.debug("'{}' {}", text, result);
        return result;
    }

    /**
     * Create a builder for custom analyzer configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean simplify = AnalyzerConfig.DEFAULT.simplify();
        private int maxInputLength = AnalyzerConfig.DEFAULT.maxInputLength();

        private Builder() {}

        public Builder simplify(boolean enabled) {
            this.simplify = enabled;
            return this;
        }

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Verge build() {
            return create(new AnalyzerConfig(simplify, maxInputLength));
        }
    }
}
