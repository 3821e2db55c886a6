package org.pragmatica.verge.function;

import org.pragmatica.verge.function.AsymptoticFunction.AddFunction;
import org.pragmatica.verge.function.AsymptoticFunction.DivideFunction;
import org.pragmatica.verge.function.AsymptoticFunction.MultiplyFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Polynomial;
import org.pragmatica.verge.function.AsymptoticFunction.RationalFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Sqrt;

import java.util.OptionalDouble;

/**
 * Degree d of functions behaving like c * n^d, where it can be read off the structure.
 * Empty when the function is not of polynomial order or its leading terms may cancel.
 */
public final class Degrees {
    private Degrees() {}

    public static OptionalDouble of(AsymptoticFunction function) {
        if (function instanceof Polynomial polynomial) {
            return polynomial.isZero()
                   ? OptionalDouble.empty()
                   : OptionalDouble.of(polynomial.degree());
        }
        if (function instanceof RationalFunction rational) {
            return difference(of(rational.numerator()), of(rational.denominator()));
        }
        if (function instanceof DivideFunction divide) {
            return difference(of(divide.numerator()), of(divide.denominator()));
        }
        if (function instanceof MultiplyFunction multiply) {
            var left = of(multiply.left());
            var right = of(multiply.right());
            return left.isPresent() && right.isPresent()
                   ? OptionalDouble.of(left.getAsDouble() + right.getAsDouble())
                   : OptionalDouble.empty();
        }
        if (function instanceof AddFunction add) {
            var left = of(add.left());
            var right = of(add.right());
            // equal degrees may cancel
            return left.isPresent() && right.isPresent() && left.getAsDouble() != right.getAsDouble()
                   ? OptionalDouble.of(Math.max(left.getAsDouble(), right.getAsDouble()))
                   : OptionalDouble.empty();
        }
        if (function instanceof Sqrt sqrt) {
            var inner = of(sqrt.argument());
            return inner.isPresent()
                   ? OptionalDouble.of(inner.getAsDouble() / 2)
                   : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    private static OptionalDouble difference(OptionalDouble numerator, OptionalDouble denominator) {
        return numerator.isPresent() && denominator.isPresent()
               ? OptionalDouble.of(numerator.getAsDouble() - denominator.getAsDouble())
               : OptionalDouble.empty();
    }
}
