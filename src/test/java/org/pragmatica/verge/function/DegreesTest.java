package org.pragmatica.verge.function;

import org.junit.jupiter.api.Test;
import org.pragmatica.verge.function.AsymptoticFunction.AddFunction;
import org.pragmatica.verge.function.AsymptoticFunction.DivideFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Ln;
import org.pragmatica.verge.function.AsymptoticFunction.MultiplyFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Polynomial;
import org.pragmatica.verge.function.AsymptoticFunction.RationalFunction;
import org.pragmatica.verge.function.AsymptoticFunction.Sin;
import org.pragmatica.verge.function.AsymptoticFunction.Sqrt;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class DegreesTest {

    private static final Polynomial N = Polynomial.variable();

    @Test
    void of_polynomial_itsDegree() {
        assertEquals(OptionalDouble.of(2), Degrees.of(Polynomial.of(1, 0, 3)));
        assertEquals(OptionalDouble.of(0), Degrees.of(Polynomial.constant(7)));
    }

    @Test
    void of_zeroPolynomial_empty() {
        assertTrue(Degrees.of(Polynomial.ZERO).isEmpty());
    }

    @Test
    void of_quotients_degreeDifference() {
        assertEquals(OptionalDouble.of(-1), Degrees.of(new RationalFunction(Polynomial.of(0, 0, 1), Polynomial.of(0, 0, 0, 1))));
        assertEquals(OptionalDouble.of(-0.5), Degrees.of(new DivideFunction(new Sqrt(N), N)));
    }

    @Test
    void of_product_degreeSum() {
        assertEquals(OptionalDouble.of(1.5), Degrees.of(new MultiplyFunction(new Sqrt(N), N)));
    }

    @Test
    void of_sqrt_halfTheArgument() {
        assertEquals(OptionalDouble.of(0.5), Degrees.of(new Sqrt(N)));
        assertEquals(OptionalDouble.of(1), Degrees.of(new Sqrt(Polynomial.of(1, 0, 1))));
    }

    @Test
    void of_sumOfDifferentDegrees_higherOne() {
        assertEquals(OptionalDouble.of(0.5), Degrees.of(new AddFunction(new Sqrt(N), Polynomial.constant(5))));
    }

    @Test
    void of_sumOfEqualDegrees_emptyAsTermsMayCancel() {
        assertTrue(Degrees.of(new AddFunction(new Sqrt(N), new Sqrt(N))).isEmpty());
    }

    @Test
    void of_nonPolynomialOrder_empty() {
        assertTrue(Degrees.of(new Ln(N)).isEmpty());
        assertTrue(Degrees.of(new Sqrt(new Sin(N))).isEmpty());
        assertTrue(Degrees.of(new MultiplyFunction(new Ln(N), N)).isEmpty());
    }
}
