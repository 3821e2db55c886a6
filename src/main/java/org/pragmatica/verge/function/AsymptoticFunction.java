package org.pragmatica.verge.function;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical representation of a sequence for taking the limit as n grows.
 *
 * <p>The variant set is closed. {@link #add}, {@link #multiply} and {@link #divide} are total:
 * combining any two instances yields another instance, folding into the most specific
 * variant that {@link FunctionAlgebra} knows of and falling back to a generic composite.
 */
public sealed interface AsymptoticFunction {

    default AsymptoticFunction add(AsymptoticFunction other) {
        return FunctionAlgebra.add(this, other);
    }

    default AsymptoticFunction multiply(AsymptoticFunction other) {
        return FunctionAlgebra.multiply(this, other);
    }

    default AsymptoticFunction divide(AsymptoticFunction other) {
        return FunctionAlgebra.divide(this, other);
    }

    default AsymptoticFunction negate() {
        return multiply(Polynomial.constant(-1));
    }

    // === Polynomial ===

    /**
     * Coefficients by ascending power of n. High-order zeros are trimmed, so the zero
     * polynomial is exactly {@code [0]}.
     */
    record Polynomial(List<Double> coefficients) implements AsymptoticFunction {
        public static final Polynomial ZERO = constant(0);
        public static final Polynomial ONE = constant(1);

        public Polynomial {
            if (coefficients.isEmpty()) {
                throw new IllegalArgumentException("Polynomial needs at least one coefficient");
            }
            int size = coefficients.size();
            while (size > 1 && coefficients.get(size - 1) == 0.0) {
                size-- ;
            }
            var trimmed = new ArrayList<Double>(size);
            for (int i = 0; i < size; i++) {
                var c = coefficients.get(i);
                // -0.0 would break record equality
                trimmed.add(c == 0.0 ? 0.0 : c);
            }
            coefficients = List.copyOf(trimmed);
        }

        public static Polynomial of(double... coefficients) {
            var list = new ArrayList<Double>(coefficients.length);
            for (var c : coefficients) {
                list.add(c);
            }
            return new Polynomial(list);
        }

        public static Polynomial constant(double value) {
            return of(value);
        }

        /**
         * The variable n itself.
         */
        public static Polynomial variable() {
            return of(0, 1);
        }

        public int degree() {
            return coefficients.size() - 1;
        }

        public double coefficient(int power) {
            return power < coefficients.size()
                   ? coefficients.get(power)
                   : 0.0;
        }

        public double leading() {
            return coefficients.get(degree());
        }

        public boolean isConstant() {
            return degree() == 0;
        }

        public boolean isZero() {
            return isConstant() && leading() == 0.0;
        }
    }

    // === Rational function ===

    /**
     * Quotient of two functions, typically two polynomials.
     */
    record RationalFunction(AsymptoticFunction numerator, AsymptoticFunction denominator) implements AsymptoticFunction {
        public boolean isPolynomialRatio() {
            return numerator instanceof Polynomial && denominator instanceof Polynomial;
        }
    }

    // === Generic composites ===

    record AddFunction(AsymptoticFunction left, AsymptoticFunction right) implements AsymptoticFunction {}

    record MultiplyFunction(AsymptoticFunction left, AsymptoticFunction right) implements AsymptoticFunction {}

    record DivideFunction(AsymptoticFunction numerator, AsymptoticFunction denominator) implements AsymptoticFunction {}

    // === Transcendental wrappers ===

    sealed interface Transcendental extends AsymptoticFunction {
        AsymptoticFunction argument();
    }

    record Sin(AsymptoticFunction argument) implements Transcendental {}

    record Cos(AsymptoticFunction argument) implements Transcendental {}

    record Tan(AsymptoticFunction argument) implements Transcendental {}

    /**
     * Logarithm to a fixed base.
     */
    record Log(double base, AsymptoticFunction argument) implements Transcendental {}

    record Ln(AsymptoticFunction argument) implements Transcendental {}

    record Sqrt(AsymptoticFunction argument) implements Transcendental {}

    record Exp(AsymptoticFunction argument) implements Transcendental {}

    // === Exponential with constant base ===

    /**
     * {@code base ^ exponent} for a fixed real base: 2^n, 0.5^(2n), 10^(-n).
     */
    record ConstantBaseExpFunction(double base, AsymptoticFunction exponent) implements AsymptoticFunction {}
}
