package org.pragmatica.verge.limit;

/**
 * Rate class of a divergent (or decaying) branch. Ordered slowest first:
 * logarithmic, polynomial, exponential.
 */
public enum GrowthKind {
    LOGARITHMIC,
    POLYNOMIAL,
    EXPONENTIAL;

    public boolean dominates(GrowthKind other) {
        return compareTo(other) > 0;
    }

    public static GrowthKind faster(GrowthKind left, GrowthKind right) {
        return left.dominates(right)
               ? left
               : right;
    }
}
