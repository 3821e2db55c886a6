package org.pragmatica.verge.limit;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of taking the limit of a sequence: a finite limit, a signed infinity, or neither.
 */
public sealed interface ConvergenceResult {

    boolean converges();

    /**
     * Finite limit, present only for {@link Converges}.
     */
    OptionalDouble limit();

    /**
     * Signed infinity, present only for {@link DivergesToInfinity}. Absent on a non-converging
     * result means the sequence oscillates or could not be resolved.
     */
    OptionalDouble divergeTo();

    Optional<GrowthKind> growthKind();

    /**
     * Finite limit.
     */
    record Converges(double value, GrowthKind growth) implements ConvergenceResult {
        public Converges {
            // fold -0.0 into 0.0
            value = value == 0.0
                    ? 0.0
                    : value;
        }

        @Override
        public boolean converges() {
            return true;
        }

        @Override
        public OptionalDouble limit() {
            return OptionalDouble.of(value);
        }

        @Override
        public OptionalDouble divergeTo() {
            return OptionalDouble.empty();
        }

        @Override
        public Optional<GrowthKind> growthKind() {
            return Optional.of(growth);
        }

        @Override
        public String toString() {
            return "converges to " + value + " (" + growth + ")";
        }
    }

    /**
     * Grows without bound in a determinate direction.
     */
    record DivergesToInfinity(Direction direction, GrowthKind growth) implements ConvergenceResult {
        @Override
        public boolean converges() {
            return false;
        }

        @Override
        public OptionalDouble limit() {
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble divergeTo() {
            return OptionalDouble.of(direction.infinity());
        }

        @Override
        public Optional<GrowthKind> growthKind() {
            return Optional.of(growth);
        }

        @Override
        public String toString() {
            return "diverges to " + (direction == Direction.POSITIVE ? "+" : "-") + "infinity (" + growth + ")";
        }
    }

    /**
     * No limit and no signed trend: bounded oscillation or an unresolved form.
     */
    record DivergesIndeterminate() implements ConvergenceResult {
        @Override
        public boolean converges() {
            return false;
        }

        @Override
        public OptionalDouble limit() {
            return OptionalDouble.empty();
        }

        @Override
        public OptionalDouble divergeTo() {
            return OptionalDouble.empty();
        }

        @Override
        public Optional<GrowthKind> growthKind() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "diverges (indeterminate)";
        }
    }

    DivergesIndeterminate INDETERMINATE = new DivergesIndeterminate();

    static ConvergenceResult converges(double value, GrowthKind growth) {
        return new Converges(value, growth);
    }

    static ConvergenceResult divergesTo(Direction direction, GrowthKind growth) {
        return new DivergesToInfinity(direction, growth);
    }

    static ConvergenceResult indeterminate() {
        return INDETERMINATE;
    }
}
