package org.shipplan.transport.modi;

/**
 * Hard cap on the number of MODI pivots for one solve.
 */
final class IterationBudget {
    private final int maxIterations;

    private IterationBudget(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    static IterationBudget of(int maxIterations) {
        return new IterationBudget(maxIterations);
    }

    /**
     * Returns true when another pivot may run after {@code completed} pivots.
     */
    boolean allowsAnother(int completed) {
        return completed < maxIterations;
    }

    int maxIterations() {
        return maxIterations;
    }
}
