package org.pragmatica.verge.limit;

import org.pragmatica.verge.error.AnalysisError;
import org.pragmatica.verge.error.AnalysisException;
import org.pragmatica.verge.function.AsymptoticFunction;
import org.pragmatica.verge.function.AsymptoticFunction.AddFunction;
import org.pragmatica.verge.function.AsymptoticFunction.ConstantBaseExpFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Cos;
import org.pragmatica.verge.function.AsymptoticFunction.DivideFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Exp;
import org.pragmatica.verge.function.AsymptoticFunction.Ln;
import org.pragmatica.verge.function.AsymptoticFunction.Log;
import org.pragmatica.verge.function.AsymptoticFunction.MultiplyFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Polynomial;
import org.pragmatica.verge.function.AsymptoticFunction.RationalFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Sin;
import org.pragmatica.verge.function.AsymptoticFunction.Sqrt;
import org.pragmatica.verge.function.AsymptoticFunction.Tan;
import org.pragmatica.verge.function.AsymptoticFunction.Transcendental;
import org.pragmatica.verge.function.Degrees;
import org.pragmatica.verge.limit.ConvergenceResult.Converges;
import org.pragmatica.verge.limit.ConvergenceResult.DivergesToInfinity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

import static org.pragmatica.verge.limit.ConvergenceResult.converges;
import static org.pragmatica.verge.limit.ConvergenceResult.divergesTo;
import static org.pragmatica.verge.limit.ConvergenceResult.indeterminate;

/**
 * Limit of an {@link AsymptoticFunction} as n grows without bound.
 *
 * <p>Structural recursion over the function: every variant is classified from the
 * classification of its parts, with the indeterminate forms resolved by growth class.
 * Two divergent branches of the same class are resolved only where the structure shows
 * the answer (degree, dominant term, logarithm ratio); otherwise the result is
 * {@link ConvergenceResult.DivergesIndeterminate}, leading coefficients are never compared.
 */
public final class LimitEvaluator {
    private static final Logger log = LoggerFactory.getLogger(LimitEvaluator.class);

    private LimitEvaluator() {}

    public static ConvergenceResult converge(AsymptoticFunction function) {
        var result = classify(function);
        log.trace("{} -> {}", function, result);
        return result;
    }

    private static ConvergenceResult classify(AsymptoticFunction function) {
        if (function instanceof Polynomial polynomial) {
            return polynomial(polynomial);
        }
        if (function instanceof RationalFunction rational) {
            return rational.isPolynomialRatio()
                   ? polynomialRatio((Polynomial) rational.numerator(), (Polynomial) rational.denominator())
                   : quotient(rational.numerator(), rational.denominator());
        }
        if (function instanceof AddFunction add) {
            return sum(add.left(), add.right());
        }
        if (function instanceof MultiplyFunction multiply) {
            return product(multiply.left(), multiply.right());
        }
        if (function instanceof DivideFunction divide) {
            return quotient(divide.numerator(), divide.denominator());
        }
        if (function instanceof ConstantBaseExpFunction exponential) {
            return constantBase(exponential.base(), converge(exponential.exponent()));
        }
        if (function instanceof Transcendental transcendental) {
            return transcendental(transcendental);
        }
        throw new IllegalStateException("Unhandled function variant " + function.getClass().getSimpleName());
    }

    // === Polynomials ===

    private static ConvergenceResult polynomial(Polynomial polynomial) {
        var leading = polynomial.leading();
        // overflowing coefficients cancel to NaN
        if (Double.isNaN(leading)) {
            return indeterminate();
        }
        if (polynomial.isConstant()) {
            return finiteOrSigned(leading, GrowthKind.POLYNOMIAL);
        }
        return divergesTo(Direction.of(leading), GrowthKind.POLYNOMIAL);
    }

    private static ConvergenceResult polynomialRatio(Polynomial numerator, Polynomial denominator) {
        if (denominator.isZero()) {
            return indeterminate();
        }
        if (numerator.isZero() || numerator.degree() < denominator.degree()) {
            return converges(0, GrowthKind.POLYNOMIAL);
        }
        var ratio = numerator.leading() / denominator.leading();
        if (Double.isNaN(ratio)) {
            return indeterminate();
        }
        if (numerator.degree() == denominator.degree()) {
            return finiteOrSigned(ratio, GrowthKind.POLYNOMIAL);
        }
        // the ratio itself may underflow to zero
        var sign = Math.signum(numerator.leading()) * Math.signum(denominator.leading());
        return divergesTo(Direction.of(sign), GrowthKind.POLYNOMIAL);
    }

    // === Constant base exponential ===

    private static ConvergenceResult constantBase(double base, ConvergenceResult exponent) {
        if (exponent instanceof Converges finite) {
            var value = Math.pow(base, finite.value());
            if (Double.isNaN(value)) {
                return indeterminate();
            }
            return Double.isInfinite(value)
                   ? divergesTo(Direction.of(value), GrowthKind.EXPONENTIAL)
                   : converges(value, GrowthKind.EXPONENTIAL);
        }
        if (!(exponent instanceof DivergesToInfinity infinite)) {
            return indeterminate();
        }
        var magnitude = Math.abs(base);
        if (base == 1) {
            return converges(1, GrowthKind.EXPONENTIAL);
        }
        if (base == -1) {
            return indeterminate();
        }
        if (infinite.direction() == Direction.POSITIVE) {
            if (magnitude < 1) {
                return converges(0, GrowthKind.EXPONENTIAL);
            }
            return base > 1
                   ? divergesTo(Direction.POSITIVE, GrowthKind.EXPONENTIAL)
                   : indeterminate();
        }
        // b^(-inf) behaves like (1/b)^(+inf)
        if (magnitude > 1) {
            return converges(0, GrowthKind.EXPONENTIAL);
        }
        return base > 0
               ? divergesTo(Direction.POSITIVE, GrowthKind.EXPONENTIAL)
               : indeterminate();
    }

    // === Transcendental wrappers ===

    private static ConvergenceResult transcendental(Transcendental function) {
        if (function instanceof Tan) {
            throw new AnalysisException(new AnalysisError.UnsupportedOperation(
                "limit of tan is undefined, the function has periodic singularities"));
        }
        var argument = converge(function.argument());
        if (argument instanceof Converges finite) {
            return atFiniteArgument(function, finite);
        }
        if (argument instanceof DivergesToInfinity infinite) {
            return atInfiniteArgument(function, infinite.direction());
        }
        return indeterminate();
    }

    private static ConvergenceResult atFiniteArgument(Transcendental function, Converges argument) {
        var x = argument.value();
        if (function instanceof Exp) {
            return finiteOrSigned(Math.exp(x), GrowthKind.EXPONENTIAL);
        }
        if (function instanceof Ln) {
            return finiteOrSigned(Math.log(x), GrowthKind.LOGARITHMIC);
        }
        if (function instanceof Log logarithm) {
            return finiteOrSigned(Math.log(x) / Math.log(logarithm.base()), GrowthKind.LOGARITHMIC);
        }
        if (function instanceof Sin) {
            return converges(Math.sin(x), argument.growth());
        }
        if (function instanceof Cos) {
            return converges(Math.cos(x), argument.growth());
        }
        if (function instanceof Sqrt) {
            return x < 0
                   ? indeterminate()
                   : converges(Math.sqrt(x), argument.growth());
        }
        throw new IllegalStateException("Unhandled transcendental " + function.getClass().getSimpleName());
    }

    private static ConvergenceResult finiteOrSigned(double value, GrowthKind growth) {
        if (Double.isNaN(value)) {
            return indeterminate();
        }
        return Double.isInfinite(value)
               ? divergesTo(Direction.of(value), growth)
               : converges(value, growth);
    }

    private static ConvergenceResult atInfiniteArgument(Transcendental function, Direction direction) {
        var positive = direction == Direction.POSITIVE;
        if (function instanceof Exp) {
            return positive
                   ? divergesTo(Direction.POSITIVE, GrowthKind.EXPONENTIAL)
                   : converges(0, GrowthKind.EXPONENTIAL);
        }
        if (function instanceof Ln) {
            return positive
                   ? divergesTo(Direction.POSITIVE, GrowthKind.LOGARITHMIC)
                   : indeterminate();
        }
        if (function instanceof Log logarithm) {
            return positive
                   ? divergesTo(Direction.of(Math.log(logarithm.base())), GrowthKind.LOGARITHMIC)
                   : indeterminate();
        }
        if (function instanceof Sqrt) {
            return positive
                   ? divergesTo(Direction.POSITIVE, GrowthKind.POLYNOMIAL)
                   : indeterminate();
        }
        // sin and cos oscillate
        return indeterminate();
    }

    // === Sum ===

    private static ConvergenceResult sum(AsymptoticFunction leftFunction, AsymptoticFunction rightFunction) {
        var left = converge(leftFunction);
        var right = converge(rightFunction);

        if (left instanceof Converges l && right instanceof Converges r) {
            return finiteOrSigned(l.value() + r.value(), GrowthKind.faster(l.growth(), r.growth()));
        }
        if (left instanceof Converges && right instanceof DivergesToInfinity) {
            return right;
        }
        if (left instanceof DivergesToInfinity && right instanceof Converges) {
            return left;
        }
        if (left instanceof DivergesToInfinity l && right instanceof DivergesToInfinity r) {
            if (l.growth() != r.growth()) {
                return l.growth().dominates(r.growth())
                       ? l
                       : r;
            }
            // opposite infinities of the same growth are not compared
            return l.direction() == r.direction()
                   ? l
                   : indeterminate();
        }
        return indeterminate();
    }

    // === Product ===

    private static ConvergenceResult product(AsymptoticFunction leftFunction, AsymptoticFunction rightFunction) {
        var left = converge(leftFunction);
        var right = converge(rightFunction);

        if (left instanceof Converges l && right instanceof Converges r) {
            return finiteOrSigned(l.value() * r.value(), GrowthKind.faster(l.growth(), r.growth()));
        }
        if (left instanceof DivergesToInfinity l && right instanceof DivergesToInfinity r) {
            return divergesTo(l.direction().times(r.direction()), GrowthKind.faster(l.growth(), r.growth()));
        }
        if (left instanceof Converges l) {
            return finiteTimes(l, leftFunction, right, rightFunction);
        }
        if (right instanceof Converges r) {
            return finiteTimes(r, rightFunction, left, leftFunction);
        }
        return indeterminate();
    }

    private static ConvergenceResult finiteTimes(Converges finite,
                                                 AsymptoticFunction finiteFunction,
                                                 ConvergenceResult other,
                                                 AsymptoticFunction otherFunction) {
        if (other instanceof DivergesToInfinity infinite) {
            if (finite.value() != 0) {
                return divergesTo(Direction.of(finite.value()).times(infinite.direction()), infinite.growth());
            }
            return zeroTimesInfinity(finite, finiteFunction, infinite, otherFunction);
        }
        // bounded oscillation times a null sequence
        return finite.value() == 0
               ? converges(0, finite.growth())
               : indeterminate();
    }

    private static ConvergenceResult zeroTimesInfinity(Converges zero,
                                                       AsymptoticFunction zeroFunction,
                                                       DivergesToInfinity infinite,
                                                       AsymptoticFunction infiniteFunction) {
        if (zero.growth().dominates(infinite.growth())) {
            return converges(0, zero.growth());
        }
        if (zero.growth() == GrowthKind.POLYNOMIAL && infinite.growth() == GrowthKind.POLYNOMIAL) {
            var total = sumOfDegrees(zeroFunction, infiniteFunction);
            if (total.isPresent() && total.getAsDouble() < 0) {
                return converges(0, GrowthKind.POLYNOMIAL);
            }
        }
        return indeterminate();
    }

    private static OptionalDouble sumOfDegrees(AsymptoticFunction left, AsymptoticFunction right) {
        var l = Degrees.of(left);
        var r = Degrees.of(right);
        return l.isPresent() && r.isPresent()
               ? OptionalDouble.of(l.getAsDouble() + r.getAsDouble())
               : OptionalDouble.empty();
    }

    // === Quotient ===

    private static ConvergenceResult quotient(AsymptoticFunction numeratorFunction, AsymptoticFunction denominatorFunction) {
        var numerator = converge(numeratorFunction);
        var denominator = converge(denominatorFunction);

        if (numerator instanceof DivergesToInfinity n && denominator instanceof DivergesToInfinity d) {
            if (n.growth().dominates(d.growth())) {
                return divergesTo(n.direction().times(d.direction()), n.growth());
            }
            if (d.growth().dominates(n.growth())) {
                return converges(0, GrowthKind.POLYNOMIAL);
            }
            return sameGrowthQuotient(numeratorFunction, denominatorFunction, n, d);
        }
        if (numerator instanceof Converges n && denominator instanceof Converges d) {
            return d.value() == 0
                   ? indeterminate()
                   : finiteOrSigned(n.value() / d.value(), GrowthKind.faster(n.growth(), d.growth()));
        }
        if (denominator instanceof DivergesToInfinity) {
            // finite or bounded over infinite
            return converges(0, GrowthKind.POLYNOMIAL);
        }
        if (numerator instanceof DivergesToInfinity n && denominator instanceof Converges d && d.value() != 0) {
            return divergesTo(n.direction().times(Direction.of(d.value())), n.growth());
        }
        return indeterminate();
    }

    private static ConvergenceResult sameGrowthQuotient(AsymptoticFunction numeratorFunction,
                                                        AsymptoticFunction denominatorFunction,
                                                        DivergesToInfinity numerator,
                                                        DivergesToInfinity denominator) {
        var reducedNumerator = dominantTerm(numeratorFunction);
        var reducedDenominator = dominantTerm(denominatorFunction);
        if (reducedNumerator != numeratorFunction || reducedDenominator != denominatorFunction) {
            log.trace("Reduced quotient to dominant terms {} / {}", reducedNumerator, reducedDenominator);
            return converge(reducedNumerator.divide(reducedDenominator));
        }

        var logarithmRatio = logarithmRatio(numeratorFunction, denominatorFunction);
        if (logarithmRatio.isPresent()) {
            return converges(logarithmRatio.getAsDouble(), GrowthKind.LOGARITHMIC);
        }

        if (numerator.growth() == GrowthKind.POLYNOMIAL) {
            var numeratorDegree = Degrees.of(numeratorFunction);
            var denominatorDegree = Degrees.of(denominatorFunction);
            if (numeratorDegree.isPresent() && denominatorDegree.isPresent()) {
                if (numeratorDegree.getAsDouble() < denominatorDegree.getAsDouble()) {
                    return converges(0, GrowthKind.POLYNOMIAL);
                }
                if (numeratorDegree.getAsDouble() > denominatorDegree.getAsDouble()) {
                    return divergesTo(numerator.direction().times(denominator.direction()), GrowthKind.POLYNOMIAL);
                }
            }
        }
        return indeterminate();
    }

    /**
     * Strip addends that grow strictly slower than the rest.
     */
    private static AsymptoticFunction dominantTerm(AsymptoticFunction function) {
        if (!(function instanceof AddFunction add)) {
            return function;
        }
        var left = converge(add.left());
        var right = converge(add.right());

        if (left instanceof DivergesToInfinity l && right instanceof DivergesToInfinity r) {
            if (l.growth().dominates(r.growth())) {
                return dominantTerm(add.left());
            }
            if (r.growth().dominates(l.growth())) {
                return dominantTerm(add.right());
            }
            return function;
        }
        if (left instanceof DivergesToInfinity && right instanceof Converges) {
            return dominantTerm(add.left());
        }
        if (right instanceof DivergesToInfinity && left instanceof Converges) {
            return dominantTerm(add.right());
        }
        return function;
    }

    /**
     * log_a(P(n)) / log_b(Q(n)) tends to (deg P / ln a) / (deg Q / ln b).
     */
    private static OptionalDouble logarithmRatio(AsymptoticFunction numerator, AsymptoticFunction denominator) {
        var n = logarithmScale(numerator);
        var d = logarithmScale(denominator);
        return n.isPresent() && d.isPresent()
               ? OptionalDouble.of(n.getAsDouble() / d.getAsDouble())
               : OptionalDouble.empty();
    }

    private static OptionalDouble logarithmScale(AsymptoticFunction function) {
        AsymptoticFunction argument;
        double scale;
        if (function instanceof Ln ln) {
            argument = ln.argument();
            scale = 1;
        }else if (function instanceof Log logarithm) {
            argument = logarithm.argument();
            scale = 1 / Math.log(logarithm.base());
        }else {
            return OptionalDouble.empty();
        }
        var degree = Degrees.of(argument);
        return degree.isPresent() && degree.getAsDouble() > 0
               ? OptionalDouble.of(degree.getAsDouble() * scale)
               : OptionalDouble.empty();
    }
}
