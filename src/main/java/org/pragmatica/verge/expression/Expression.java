package org.pragmatica.verge.expression;

/**
 * Expression tree produced by {@link ExpressionParser}. Nodes are immutable and own their children.
 */
public sealed interface Expression {

    enum Sign {
        PLUS("+"),
        MINUS("-");

        private final String symbol;

        Sign(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    // === Terminals ===

    /**
     * Number literal, already carrying a folded leading sign: 2, -0.5
     */
    record NumericLiteral(double value) implements Expression {}

    /**
     * The variable. The name is kept as written but carries no meaning.
     */
    record Identifier(String name) implements Expression {}

    // === Operators ===

    /**
     * Unary sign: -e, +e
     */
    record UnaryExpression(Sign sign, Expression operand) implements Expression {}

    /**
     * Binary arithmetic: e1 + e2, e1 - e2, e1 * e2, e1 / e2
     */
    record BinaryExpression(Operator operator, Expression left, Expression right) implements Expression {}

    /**
     * Power: e1 ^ e2
     */
    record PowerExpression(Expression base, Expression exponent) implements Expression {}

    /**
     * Call of a reserved function with a single argument: name(e)
     */
    record FunctionCall(String name, Expression argument) implements Expression {}

    static NumericLiteral literal(double value) {
        return new NumericLiteral(value);
    }
}
