package org.shipplan.transport.trace;

import java.util.List;
import java.util.Objects;

/**
 * Fully materialized step log: the initial record followed by every pivot in order.
 *
 * @param initial north-west corner starting point.
 * @param iterations committed pivots, chronological.
 * @param status how the solve ended.
 */
public record SolveTrace(InitialRecord initial, List<IterationRecord> iterations, SolveStatus status) {

    public SolveTrace {
        Objects.requireNonNull(initial, "initial");
        iterations = List.copyOf(Objects.requireNonNull(iterations, "iterations"));
        Objects.requireNonNull(status, "status");
    }

    /**
     * Total cost after the last pivot, or the initial cost when no pivot ran.
     */
    public double finalCost() {
        return iterations.isEmpty()
                ? initial.getTotalCost()
                : iterations.get(iterations.size() - 1).getTotalCost();
    }
}
