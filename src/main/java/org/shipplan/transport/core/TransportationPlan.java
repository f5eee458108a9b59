package org.shipplan.transport.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.OpportunityCostTable;
import org.shipplan.transport.model.Potentials;
import org.shipplan.transport.model.TransportationProblem;
import org.shipplan.transport.trace.ShipmentLine;
import org.shipplan.transport.trace.SolveTrace;

import java.util.List;

/**
 * Optimal shipment plan returned by {@link TransportationSolver}.
 */
@Value
@Builder
public class TransportationPlan {
    /** Validated problem the plan answers. */
    TransportationProblem problem;
    /** Final shipped quantities (m x n). */
    double[][] allocation;
    /** Minimum total cost. */
    double totalCost;
    /** Cost of the north-west corner start. */
    double initialCost;
    /** Number of MODI pivots performed. */
    int iterations;
    /** Final basis, row-major. */
    @Singular("basicCell")
    List<Cell> basicCells;
    /** Potentials of the final basis. */
    Potentials potentials;
    /** Reduced costs of the final basis. */
    OpportunityCostTable opportunityCosts;
    /** Shipment summary rows, row-major, positive quantities only. */
    @Singular("shipment")
    List<ShipmentLine> shipments;
    /** Initial record plus every pivot. */
    SolveTrace trace;

    /**
     * Returns a copy of the final allocation grid.
     */
    public double[][] getAllocation() {
        double[][] copy = new double[allocation.length][];
        for (int r = 0; r < allocation.length; r++) {
            copy[r] = allocation[r].clone();
        }
        return copy;
    }

    /**
     * Quantity shipped at one cell.
     */
    public double quantity(int row, int column) {
        return allocation[row][column];
    }

    /**
     * Quantity shipped between two labeled sites.
     *
     * @throws org.shipplan.core.id.SiteIndex.UnknownSiteException when a label is not mapped.
     */
    public double quantity(String warehouse, String destination) {
        return allocation[problem.warehouses().toIndex(warehouse)][problem.destinations().toIndex(destination)];
    }
}
