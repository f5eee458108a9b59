package org.shipplan.transport.modi;

import org.shipplan.transport.model.Cell;

/**
 * Deterministic choice between equally good entering or leaving candidates.
 */
public enum TieBreakPolicy {
    /** Lowest row first, then lowest column. */
    LOWEST_INDEX,
    /** Last candidate in row-major order. */
    HIGHEST_INDEX;

    /**
     * Returns true when {@code candidate} should replace {@code incumbent} on a tie.
     */
    boolean prefers(Cell candidate, Cell incumbent) {
        int order = candidate.compareTo(incumbent);
        return this == LOWEST_INDEX ? order < 0 : order > 0;
    }
}
