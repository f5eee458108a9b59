package org.shipplan.transport.trace;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.shipplan.transport.model.Cell;

import java.util.List;

/**
 * Starting point of a solve: the north-west corner allocation and its cost.
 */
@Value
@Builder
public class InitialRecord {
    /** Initial shipped quantities (m x n). */
    double[][] allocation;
    /** Basic cells of the initial basis, row-major. */
    @Singular("basicCell")
    List<Cell> basicCells;
    /** Zero-valued cells inserted for degeneracy. */
    int phantomCells;
    /** Total cost of the initial allocation. */
    double totalCost;

    /**
     * Returns a copy of the initial allocation grid.
     */
    public double[][] getAllocation() {
        double[][] copy = new double[allocation.length][];
        for (int r = 0; r < allocation.length; r++) {
            copy[r] = allocation[r].clone();
        }
        return copy;
    }
}
