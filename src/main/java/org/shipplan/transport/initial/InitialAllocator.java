package org.shipplan.transport.initial;

import org.shipplan.transport.model.TransportationProblem;

/**
 * Produces a starting basic feasible solution for the reoptimizer.
 */
public interface InitialAllocator {

    /**
     * Builds an allocation whose rows sum to supply, columns sum to demand, with a basis
     * of exactly {@code m + n - 1} cells forming a spanning tree.
     *
     * @param problem validated balanced problem.
     * @param zeroTolerance absolute tolerance for treating a remaining quantity as exhausted.
     * @return initial allocation and basis.
     */
    InitialBasis allocate(TransportationProblem problem, double zeroTolerance);
}
