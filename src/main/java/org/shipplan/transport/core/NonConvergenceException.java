package org.shipplan.transport.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.shipplan.transport.trace.SolveTrace;

/**
 * Raised when the iteration cap is hit before the optimality condition holds.
 *
 * <p>Carries the best allocation reached so the caller can accept an approximate plan
 * or abort.</p>
 */
@Getter
@Accessors(fluent = true)
public final class NonConvergenceException extends TransportationException {
    public static final String REASON_NON_CONVERGENCE = "TPP_NON_CONVERGENCE";

    private final int iterations;
    private final double bestTotalCost;
    private final SolveTrace trace;
    private final double[][] bestAllocation;

    public NonConvergenceException(int iterations, double[][] bestAllocation, double bestTotalCost, SolveTrace trace) {
        super(
                REASON_NON_CONVERGENCE,
                "no optimal plan after " + iterations + " iterations (best total cost " + bestTotalCost + ")"
        );
        this.iterations = iterations;
        this.bestAllocation = deepCopy(bestAllocation);
        this.bestTotalCost = bestTotalCost;
        this.trace = trace;
    }

    /**
     * Returns a copy of the best allocation reached before the cap.
     */
    public double[][] bestAllocation() {
        return deepCopy(bestAllocation);
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
