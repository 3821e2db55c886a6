package org.pragmatica.verge.function;

import org.pragmatica.verge.function.AsymptoticFunction.AddFunction;
import org.pragmatica.verge.function.AsymptoticFunction.ConstantBaseExpFunction;
import org.pragmatica.verge.function.AsymptoticFunction.DivideFunction;
import org.pragmatica.verge.function.AsymptoticFunction.MultiplyFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Polynomial;
import org.pragmatica.verge.function.AsymptoticFunction.RationalFunction;
import org.pragmatica.verge.limit.ConvergenceResult;
import org.pragmatica.verge.limit.LimitEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Closure algebra of {@link AsymptoticFunction}.
 *
 * <p>Folds, most specific first:
 * <ul>
 *   <li>polynomial with polynomial: coefficient sum and convolution</li>
 *   <li>rational with polynomial or rational: fraction algebra, a polynomial counting as p/1</li>
 *   <li>constant-base exponentials: same-base exponent sum and difference, and quotients of
 *       different bases over the same exponent or over exponents with the same limit, finite
 *       or a signed infinity</li>
 * </ul>
 * Anything else becomes an {@link AddFunction}, {@link MultiplyFunction} or {@link DivideFunction}.
 */
public final class FunctionAlgebra {
    private static final Logger log = LoggerFactory.getLogger(FunctionAlgebra.class);

    private FunctionAlgebra() {}

    public static AsymptoticFunction add(AsymptoticFunction left, AsymptoticFunction right) {
        if (left instanceof Polynomial l && right instanceof Polynomial r) {
            return addPolynomials(l, r);
        }
        if (isFraction(left, right)) {
            // a/b + c/d = (ad + cb) / bd
            var numerator = numerator(left).multiply(denominator(right))
                                           .add(numerator(right).multiply(denominator(left)));
            var denominator = denominator(left).multiply(denominator(right));
            return new RationalFunction(numerator, denominator);
        }
        return new AddFunction(left, right);
    }

    public static AsymptoticFunction multiply(AsymptoticFunction left, AsymptoticFunction right) {
        if (left instanceof Polynomial l && right instanceof Polynomial r) {
            return multiplyPolynomials(l, r);
        }
        if (isFraction(left, right)) {
            return new RationalFunction(numerator(left).multiply(numerator(right)),
                                        denominator(left).multiply(denominator(right)));
        }
        if (left instanceof ConstantBaseExpFunction l && right instanceof ConstantBaseExpFunction r
            && l.base() == r.base()) {
            return new ConstantBaseExpFunction(l.base(), l.exponent().add(r.exponent()));
        }
        return new MultiplyFunction(left, right);
    }

    public static AsymptoticFunction divide(AsymptoticFunction left, AsymptoticFunction right) {
        if (left instanceof Polynomial l && right instanceof Polynomial r) {
            if (r.isConstant() && !r.isZero()) {
                return multiplyPolynomials(l, Polynomial.constant(1 / r.leading()));
            }
            return new RationalFunction(l, r);
        }
        if (isFraction(left, right)) {
            // (a/b) / (c/d) = ad / bc
            return new RationalFunction(numerator(left).multiply(denominator(right)),
                                        denominator(left).multiply(numerator(right)));
        }
        if (left instanceof ConstantBaseExpFunction l && right instanceof ConstantBaseExpFunction r) {
            return divideExponentials(l, r);
        }
        return new DivideFunction(left, right);
    }

    private static AsymptoticFunction divideExponentials(ConstantBaseExpFunction left, ConstantBaseExpFunction right) {
        if (left.base() == right.base()) {
            return new ConstantBaseExpFunction(left.base(), left.exponent().add(right.exponent().negate()));
        }
        // b1^x / b2^x = (b1/b2)^x, and b1^x / b2^y is taken as (b1/b2)^x when x and y share their limit
        if (right.base() != 0 && (left.exponent().equals(right.exponent())
                                  || shareLimit(left.exponent(), right.exponent()))) {
            log.trace("Folding {}^x / {}^y into a single base", left.base(), right.base());
            return new ConstantBaseExpFunction(left.base() / right.base(), left.exponent());
        }
        return new DivideFunction(left, right);
    }

    // Same finite value, or the same signed infinity
    private static boolean shareLimit(AsymptoticFunction left, AsymptoticFunction right) {
        var l = LimitEvaluator.converge(left);
        var r = LimitEvaluator.converge(right);
        if (l instanceof ConvergenceResult.Converges a && r instanceof ConvergenceResult.Converges b) {
            return a.value() == b.value();
        }
        return l instanceof ConvergenceResult.DivergesToInfinity x
               && r instanceof ConvergenceResult.DivergesToInfinity y
               && x.direction() == y.direction();
    }

    // Fraction algebra applies among polynomials and rationals, at least one of them rational
    private static boolean isFraction(AsymptoticFunction left, AsymptoticFunction right) {
        return (left instanceof RationalFunction || right instanceof RationalFunction)
               && isFractionOperand(left) && isFractionOperand(right);
    }

    private static boolean isFractionOperand(AsymptoticFunction function) {
        return function instanceof Polynomial || function instanceof RationalFunction;
    }

    private static AsymptoticFunction numerator(AsymptoticFunction function) {
        return function instanceof RationalFunction rational
               ? rational.numerator()
               : function;
    }

    private static AsymptoticFunction denominator(AsymptoticFunction function) {
        return function instanceof RationalFunction rational
               ? rational.denominator()
               : Polynomial.ONE;
    }

    static Polynomial addPolynomials(Polynomial left, Polynomial right) {
        int size = Math.max(left.coefficients().size(), right.coefficients().size());
        var sum = new ArrayList<Double>(size);
        for (int i = 0; i < size; i++) {
            sum.add(left.coefficient(i) + right.coefficient(i));
        }
        return new Polynomial(sum);
    }

    static Polynomial multiplyPolynomials(Polynomial left, Polynomial right) {
        int size = left.coefficients().size() + right.coefficients().size() - 1;
        var product = new double[size];
        for (int i = 0; i < left.coefficients().size(); i++) {
            for (int j = 0; j < right.coefficients().size(); j++) {
                product[i + j] += left.coefficient(i) * right.coefficient(j);
            }
        }
        return Polynomial.of(product);
    }
}
