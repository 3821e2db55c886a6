package org.pragmatica.verge.function;

import org.pragmatica.verge.error.AnalysisError;
import org.pragmatica.verge.error.AnalysisException;
import org.pragmatica.verge.expression.Expression;
import org.pragmatica.verge.expression.Expression.BinaryExpression;
import org.pragmatica.verge.expression.Expression.FunctionCall;
import org.pragmatica.verge.expression.Expression.Identifier;
import org.pragmatica.verge.expression.Expression.NumericLiteral;
import org.pragmatica.verge.expression.Expression.PowerExpression;
import org.pragmatica.verge.expression.Expression.UnaryExpression;
import org.pragmatica.verge.expression.Expressions;
import org.pragmatica.verge.expression.FunctionName;
import org.pragmatica.verge.function.AsymptoticFunction.AddFunction;
import org.pragmatica.verge.function.AsymptoticFunction.ConstantBaseExpFunction;
import org.pragmatica.verge.function.AsymptoticFunction.DivideFunction;
import org.pragmatica.verge.function.AsymptoticFunction.MultiplyFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Polynomial;
import org.pragmatica.verge.function.AsymptoticFunction.RationalFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Transcendental;
import org.pragmatica.verge.limit.ConvergenceResult;
import org.pragmatica.verge.limit.LimitEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates an expression tree into an {@link AsymptoticFunction}, bottom-up, folding
 * sub-results through {@link FunctionAlgebra} as early as possible.
 */
public final class FunctionTranslator {
    private static final Logger log = LoggerFactory.getLogger(FunctionTranslator.class);

    private FunctionTranslator() {}

    public static AsymptoticFunction parseFunction(Expression expression) {
        if (expression instanceof NumericLiteral literal) {
            return Polynomial.constant(literal.value());
        }
        if (expression instanceof Identifier) {
            return Polynomial.variable();
        }
        if (expression instanceof UnaryExpression unary) {
            var operand = parseFunction(unary.operand());
            return unary.sign() == Expression.Sign.MINUS
                   ? operand.negate()
                   : operand;
        }
        if (expression instanceof BinaryExpression binary) {
            return binary(binary);
        }
        if (expression instanceof PowerExpression power) {
            return power(power);
        }
        if (expression instanceof FunctionCall call) {
            return call(call);
        }
        throw new IllegalStateException("Unhandled expression " + expression.getClass().getSimpleName());
    }

    private static AsymptoticFunction binary(BinaryExpression binary) {
        if (binary.operator() == Expression.Operator.SUBTRACT
            && Expressions.structurallyEqual(binary.left(), binary.right())) {
            log.trace("Cancelled {} to zero", Expressions.render(binary));
            return Polynomial.ZERO;
        }
        var left = parseFunction(binary.left());
        var right = parseFunction(binary.right());
        return switch (binary.operator()) {
            case ADD -> left.add(right);
            case SUBTRACT -> left.add(right.negate());
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> left.divide(right);
        };
    }

    private static AsymptoticFunction power(PowerExpression power) {
        if (power.base() instanceof NumericLiteral literal) {
            return new ConstantBaseExpFunction(literal.value(), parseFunction(power.exponent()));
        }
        var base = parseFunction(power.base());
        if (isConstant(base)) {
            return new ConstantBaseExpFunction(constantValue(base, power), parseFunction(power.exponent()));
        }
        if (power.exponent() instanceof NumericLiteral exponent && isInteger(exponent.value())) {
            return integerPower(base, exponent.value());
        }
        // A ratio with a finite limit L is taken as the constant L, so (1+1/n)^n reads as 1^n
        if (base instanceof RationalFunction && LimitEvaluator.converge(base) instanceof ConvergenceResult.Converges limit) {
            log.trace("Base of {} taken as its limit {}", Expressions.render(power), limit.value());
            return new ConstantBaseExpFunction(limit.value(), parseFunction(power.exponent()));
        }
        throw new AnalysisException(new AnalysisError.UnsupportedExpression(
            "exponent of '" + Expressions.render(power) + "' must be an integer literal when the base depends on n"));
    }

    // Exponentiation by squaring
    private static AsymptoticFunction integerPower(AsymptoticFunction base, double exponent) {
        AsymptoticFunction product = Polynomial.ONE;
        AsymptoticFunction square = base;
        long remaining = (long) Math.abs(exponent);
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                product = product.multiply(square);
            }
            remaining >>= 1;
            if (remaining > 0) {
                square = square.multiply(square);
            }
        }
        return exponent < 0
               ? Polynomial.ONE.divide(product)
               : product;
    }

    private static boolean isInteger(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    private static AsymptoticFunction call(FunctionCall call) {
        var function = FunctionName.lookup(call.name())
                                   .orElseThrow(() -> new AnalysisException(new AnalysisError.UnknownFunction(AnalysisError.NO_OFFSET, call.name())));
        var argument = parseFunction(call.argument());
        return switch (function) {
            case SIN -> new AsymptoticFunction.Sin(argument);
            case COS -> new AsymptoticFunction.Cos(argument);
            case TAN -> new AsymptoticFunction.Tan(argument);
            case LOG10 -> new AsymptoticFunction.Log(10, argument);
            case LOG2 -> new AsymptoticFunction.Log(2, argument);
            case LN -> new AsymptoticFunction.Ln(argument);
            case SQRT -> new AsymptoticFunction.Sqrt(argument);
            case EXP -> new AsymptoticFunction.Exp(argument);
            // identity, see FunctionName.ABS
            case ABS -> argument;
        };
    }

    /**
     * Whether the function has no dependence on n.
     */
    static boolean isConstant(AsymptoticFunction function) {
        if (function instanceof Polynomial polynomial) {
            return polynomial.isConstant();
        }
        if (function instanceof RationalFunction rational) {
            return isConstant(rational.numerator()) && isConstant(rational.denominator());
        }
        if (function instanceof AddFunction add) {
            return isConstant(add.left()) && isConstant(add.right());
        }
        if (function instanceof MultiplyFunction multiply) {
            return isConstant(multiply.left()) && isConstant(multiply.right());
        }
        if (function instanceof DivideFunction divide) {
            return isConstant(divide.numerator()) && isConstant(divide.denominator());
        }
        if (function instanceof Transcendental transcendental) {
            return isConstant(transcendental.argument());
        }
        if (function instanceof ConstantBaseExpFunction exponential) {
            return isConstant(exponential.exponent());
        }
        return false;
    }

    private static double constantValue(AsymptoticFunction base, PowerExpression power) {
        var value = LimitEvaluator.converge(base);
        if (value instanceof ConvergenceResult.Converges finite) {
            return finite.value();
        }
        throw new AnalysisException(new AnalysisError.UnsupportedExpression(
            "base of '" + Expressions.render(power) + "' has no finite value"));
    }
}
