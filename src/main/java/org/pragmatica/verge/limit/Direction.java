package org.pragmatica.verge.limit;

/**
 * Sign of a divergence.
 */
public enum Direction {
    POSITIVE(1),
    NEGATIVE(-1);

    private final int signum;

    Direction(int signum) {
        this.signum = signum;
    }

    public double infinity() {
        return signum * Double.POSITIVE_INFINITY;
    }

    public Direction times(Direction other) {
        return this == other
               ? POSITIVE
               : NEGATIVE;
    }

    /**
     * Direction of a non-zero value's sign.
     */
    public static Direction of(double value) {
        if (value == 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException("No direction for " + value);
        }
        return value > 0
               ? POSITIVE
               : NEGATIVE;
    }
}
