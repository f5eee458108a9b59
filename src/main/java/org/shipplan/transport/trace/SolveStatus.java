package org.shipplan.transport.trace;

/**
 * Terminal state of a solve.
 */
public enum SolveStatus {
    OPTIMAL,
    NON_CONVERGED
}
