package org.shipplan.transport.modi;

import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.OpportunityCostTable;
import org.shipplan.transport.model.Potentials;
import org.shipplan.transport.model.TransportationProblem;

/**
 * Prices non-basic cells and picks the entering cell.
 */
public final class OpportunityCostEvaluator {

    /**
     * Computes {@code d(i,j) = cost(i,j) - (u[i] + v[j])} for every non-basic cell.
     */
    public OpportunityCostTable evaluate(TransportationProblem problem, BasicCellSet basis, Potentials potentials) {
        int rows = problem.rows();
        int columns = problem.columns();
        double[][] values = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                values[r][c] = basis.contains(r, c)
                        ? Double.NaN
                        : potentials.reducedCost(problem.cost(r, c), r, c);
            }
        }
        return new OpportunityCostTable(values);
    }

    /**
     * Returns the most negative priced cell, or {@code null} when the plan is optimal.
     *
     * <p>A cell qualifies only when {@code d < -tolerance}. Values within {@code tolerance}
     * of the current best count as a tie and are settled by {@code tieBreak}.</p>
     */
    public Cell selectEntering(OpportunityCostTable table, double tolerance, TieBreakPolicy tieBreak) {
        Cell best = null;
        double bestValue = -tolerance;
        for (int r = 0; r < table.rows(); r++) {
            for (int c = 0; c < table.columns(); c++) {
                if (!table.isPriced(r, c)) {
                    continue;
                }
                double value = table.get(r, c);
                if (value >= -tolerance) {
                    continue;
                }
                Cell candidate = new Cell(r, c);
                if (best == null || value < bestValue - tolerance) {
                    best = candidate;
                    bestValue = value;
                } else if (Math.abs(value - bestValue) <= tolerance && tieBreak.prefers(candidate, best)) {
                    best = candidate;
                    bestValue = value;
                }
            }
        }
        return best;
    }
}
