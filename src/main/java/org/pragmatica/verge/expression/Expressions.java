package org.pragmatica.verge.expression;

import org.pragmatica.verge.expression.Expression.BinaryExpression;
import org.pragmatica.verge.expression.Expression.FunctionCall;
import org.pragmatica.verge.expression.Expression.Identifier;
import org.pragmatica.verge.expression.Expression.NumericLiteral;
import org.pragmatica.verge.expression.Expression.Operator;
import org.pragmatica.verge.expression.Expression.PowerExpression;
import org.pragmatica.verge.expression.Expression.Sign;
import org.pragmatica.verge.expression.Expression.UnaryExpression;

/**
 * Utilities over raw expression trees.
 */
public final class Expressions {
    private static final int ADDITIVE = 1;
    private static final int MULTIPLICATIVE = 2;
    private static final int UNARY = 3;
    private static final int POWER = 4;
    private static final int PRIMARY = 5;

    private Expressions() {}

    /**
     * Structural equality. Any two identifiers are equal since there is only one variable,
     * literals compare by numeric value and function calls by the function they resolve to.
     */
    public static boolean structurallyEqual(Expression left, Expression right) {
        if (left instanceof Identifier && right instanceof Identifier) {
            return true;
        }
        if (left instanceof NumericLiteral l && right instanceof NumericLiteral r) {
            return l.value() == r.value();
        }
        if (left instanceof UnaryExpression l && right instanceof UnaryExpression r) {
            return l.sign() == r.sign() && structurallyEqual(l.operand(), r.operand());
        }
        if (left instanceof BinaryExpression l && right instanceof BinaryExpression r) {
            return l.operator() == r.operator()
                   && structurallyEqual(l.left(), r.left())
                   && structurallyEqual(l.right(), r.right());
        }
        if (left instanceof PowerExpression l && right instanceof PowerExpression r) {
            return structurallyEqual(l.base(), r.base()) && structurallyEqual(l.exponent(), r.exponent());
        }
        if (left instanceof FunctionCall l && right instanceof FunctionCall r) {
            return sameFunction(l.name(), r.name()) && structurallyEqual(l.argument(), r.argument());
        }
        return false;
    }

    private static boolean sameFunction(String left, String right) {
        var l = FunctionName.lookup(left);
        var r = FunctionName.lookup(right);
        return l.isPresent()
               ? l.equals(r)
               : left.equalsIgnoreCase(right);
    }

    /**
     * Algebraic identities with a neutral or absorbing literal:
     * x+0, 0+x, x-0, x*1, 1*x, x*0, 0*x, x/1, x^0, x^1, 1^x, and 0^c for a positive literal c.
     */
    public static Expression simplify(Expression expression) {
        if (expression instanceof PowerExpression power) {
            var base = simplify(power.base());
            var exponent = simplify(power.exponent());

            if (isLiteral(exponent, 0)) {
                return Expression.literal(1);
            }
            if (isLiteral(exponent, 1) || isLiteral(base, 1) || (isLiteral(base, 0) && isPositiveLiteral(exponent))) {
                return base;
            }
            return new PowerExpression(base, exponent);
        }
        if (expression instanceof UnaryExpression unary) {
            var operand = simplify(unary.operand());
            if (unary.sign() == Sign.PLUS) {
                return operand;
            }
            if (operand instanceof NumericLiteral literal) {
                return Expression.literal(-literal.value());
            }
            return new UnaryExpression(unary.sign(), operand);
        }
        if (expression instanceof FunctionCall call) {
            return new FunctionCall(call.name(), simplify(call.argument()));
        }
        if (!(expression instanceof BinaryExpression binary)) {
            return expression;
        }

        var left = simplify(binary.left());
        var right = simplify(binary.right());

        switch (binary.operator()) {
            case ADD -> {
                if (isLiteral(left, 0)) {
                    return right;
                }
                if (isLiteral(right, 0)) {
                    return left;
                }
            }
            case SUBTRACT -> {
                if (isLiteral(right, 0)) {
                    return left;
                }
            }
            case MULTIPLY -> {
                if (isLiteral(left, 1)) {
                    return right;
                }
                if (isLiteral(right, 1) || isLiteral(left, 0)) {
                    return left;
                }
                if (isLiteral(right, 0)) {
                    return right;
                }
            }
            case DIVIDE -> {
                if (isLiteral(right, 1)) {
                    return left;
                }
            }
        }
        return new BinaryExpression(binary.operator(), left, right);
    }

    private static boolean isLiteral(Expression expression, double value) {
        return expression instanceof NumericLiteral literal && literal.value() == value;
    }

    private static boolean isPositiveLiteral(Expression expression) {
        return expression instanceof NumericLiteral literal && literal.value() > 0;
    }

    /**
     * Plain-text rendering that parses back to an equal tree.
     */
    public static String render(Expression expression) {
        var sb = new StringBuilder();
        render(expression, ADDITIVE, sb);
        return sb.toString();
    }

    private static void render(Expression expression, int context, StringBuilder sb) {
        int own = precedence(expression);
        boolean wrap = own < context;
        if (wrap) {
            sb.append('(');
        }

        if (expression instanceof NumericLiteral literal) {
            sb.append(formatNumber(literal.value()));
        }else if (expression instanceof Identifier id) {
            sb.append(id.name());
        }else if (expression instanceof UnaryExpression unary) {
            sb.append(unary.sign().symbol());
            render(unary.operand(), PRIMARY, sb);
        }else if (expression instanceof BinaryExpression binary) {
            render(binary.left(), own, sb);
            sb.append(own == ADDITIVE
                      ? " " + binary.operator().symbol() + " "
                      : binary.operator().symbol());
            render(binary.right(), own + 1, sb);
        }else if (expression instanceof PowerExpression power) {
            render(power.base(), PRIMARY, sb);
            sb.append('^');
            render(power.exponent(), POWER, sb);
        }else if (expression instanceof FunctionCall call) {
            if (call.name().equalsIgnoreCase("e^")) {
                sb.append("e^");
                render(call.argument(), POWER, sb);
            }else {
                sb.append(call.name()).append('(');
                render(call.argument(), ADDITIVE, sb);
                sb.append(')');
            }
        }

        if (wrap) {
            sb.append(')');
        }
    }

    private static int precedence(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return binary.operator() == Operator.ADD || binary.operator() == Operator.SUBTRACT
                   ? ADDITIVE
                   : MULTIPLICATIVE;
        }
        if (expression instanceof UnaryExpression) {
            return UNARY;
        }
        if (expression instanceof NumericLiteral literal && literal.value() < 0) {
            return UNARY;
        }
        if (expression instanceof PowerExpression) {
            return POWER;
        }
        if (expression instanceof FunctionCall call && call.name().equalsIgnoreCase("e^")) {
            return POWER;
        }
        return PRIMARY;
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
