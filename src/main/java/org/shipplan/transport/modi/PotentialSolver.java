package org.shipplan.transport.modi;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import org.shipplan.transport.core.InvariantViolationException;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.Potentials;
import org.shipplan.transport.model.TransportationProblem;

import java.util.BitSet;

/**
 * Computes dual potentials by breadth-first propagation over the basis tree.
 *
 * <p>Node ids: rows are {@code [0, m)}, columns are {@code [m, m + n)}. The search starts
 * at row 0 with {@code u[0] = 0}; each basic cell (i,j) fixes the unknown endpoint via
 * {@code u[i] + v[j] = cost(i,j)}.</p>
 */
public final class PotentialSolver {

    /**
     * Solves u/v for the given basis.
     *
     * @param problem cost source.
     * @param basis basic cells; must be a spanning tree of size {@code m + n - 1}.
     * @param tolerance absolute tolerance for the post-solve consistency check.
     * @return potentials with {@code u[0] = 0}.
     * @throws InvariantViolationException when the basis has the wrong size, is disconnected,
     *                                     or the potentials cannot satisfy every basic cell.
     */
    public Potentials solve(TransportationProblem problem, BasicCellSet basis, double tolerance) {
        int rows = problem.rows();
        int columns = problem.columns();
        if (!basis.hasTreeSize()) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_BASIS_SIZE,
                    "basis has " + basis.size() + " cells, expected " + problem.basisSize()
            );
        }

        double[] u = new double[rows];
        double[] v = new double[columns];
        BitSet known = new BitSet(rows + columns);
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue(rows + columns);

        u[0] = 0.0d;
        known.set(0);
        queue.enqueue(0);
        int assigned = 1;

        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            if (node < rows) {
                IntList rowColumns = basis.columnsInRow(node);
                for (int i = 0; i < rowColumns.size(); i++) {
                    int column = rowColumns.getInt(i);
                    int columnNode = rows + column;
                    if (!known.get(columnNode)) {
                        v[column] = problem.cost(node, column) - u[node];
                        known.set(columnNode);
                        queue.enqueue(columnNode);
                        assigned++;
                    }
                }
            } else {
                int column = node - rows;
                IntList columnRows = basis.rowsInColumn(column);
                for (int i = 0; i < columnRows.size(); i++) {
                    int row = columnRows.getInt(i);
                    if (!known.get(row)) {
                        u[row] = problem.cost(row, column) - v[column];
                        known.set(row);
                        queue.enqueue(row);
                        assigned++;
                    }
                }
            }
        }

        if (assigned != rows + columns) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_DISCONNECTED_BASIS,
                    "basis reaches " + assigned + " of " + (rows + columns) + " row/column nodes; first unreached "
                            + describeNode(known.nextClearBit(0), rows)
            );
        }
        ensureConsistent(problem, basis, u, v, tolerance);
        return new Potentials(u, v);
    }

    private static void ensureConsistent(
            TransportationProblem problem,
            BasicCellSet basis,
            double[] u,
            double[] v,
            double tolerance
    ) {
        for (Cell cell : basis.cells()) {
            double cost = problem.cost(cell);
            double residual = cost - (u[cell.row()] + v[cell.column()]);
            double scale = Math.max(1.0d, Math.abs(cost));
            if (Math.abs(residual) > tolerance * scale) {
                throw new InvariantViolationException(
                        InvariantViolationException.REASON_POTENTIAL_CONFLICT,
                        "potentials miss basic cell " + cell + " by " + residual
                );
            }
        }
    }

    private static String describeNode(int node, int rows) {
        return node < rows ? "row " + node : "column " + (node - rows);
    }
}
