package org.shipplan.transport.modi;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.shipplan.transport.core.InvariantViolationException;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Finds the unique stepping-stone loop created by adding an entering cell to the basis tree.
 *
 * <p>The basis is read as a bipartite tree over row nodes {@code [0, m)} and column nodes
 * {@code [m, m + n)}. Adding entering cell (r, c) closes exactly one cycle: the cell itself
 * plus the tree path between row node r and column node c. The path is found with a
 * breadth-first search from row node r; walking it from r to c yields basic cells that
 * alternately share a row and a column, and the entering cell closes the loop.</p>
 *
 * <p>Loop order: the entering cell, then the basic cell sharing its row, then onward along
 * the path, ending at the basic cell that shares the entering cell's column.</p>
 */
public final class LoopFinder {
    private static final int NONE = -1;

    /**
     * Builds the loop for {@code entering}.
     *
     * @param basis current spanning-tree basis (not containing {@code entering}).
     * @param entering non-basic cell entering the basis.
     * @return loop with alternating signs starting at {@code +} on the entering cell.
     * @throws InvariantViolationException when the entering cell is already basic or no path
     *                                     joins its row and column through the basis.
     */
    public SteppingStoneLoop find(BasicCellSet basis, Cell entering) {
        if (basis.contains(entering)) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_ENTERING_CELL_BASIC,
                    "entering cell " + entering + " is already basic"
            );
        }
        int rows = basis.rows();
        int columns = basis.columns();
        int source = entering.row();
        int target = rows + entering.column();

        int[] parent = new int[rows + columns];
        Arrays.fill(parent, NONE);
        parent[source] = source;
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(source);

        while (!queue.isEmpty() && parent[target] == NONE) {
            int node = queue.dequeueInt();
            if (node < rows) {
                IntList rowColumns = basis.columnsInRow(node);
                for (int i = 0; i < rowColumns.size(); i++) {
                    int next = rows + rowColumns.getInt(i);
                    if (parent[next] == NONE) {
                        parent[next] = node;
                        queue.enqueue(next);
                    }
                }
            } else {
                IntList columnRows = basis.rowsInColumn(node - rows);
                for (int i = 0; i < columnRows.size(); i++) {
                    int next = columnRows.getInt(i);
                    if (parent[next] == NONE) {
                        parent[next] = node;
                        queue.enqueue(next);
                    }
                }
            }
        }

        if (parent[target] == NONE) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_LOOP_NOT_FOUND,
                    "no basis path joins row " + entering.row() + " and column " + entering.column()
                            + " for entering cell " + entering
            );
        }

        // node path from target back to source, then reversed into source -> target order
        IntArrayList nodePath = new IntArrayList();
        for (int node = target; node != source; node = parent[node]) {
            nodePath.add(node);
        }
        nodePath.add(source);

        List<Cell> loop = new ArrayList<>(nodePath.size());
        loop.add(entering);
        for (int i = nodePath.size() - 1; i > 0; i--) {
            loop.add(toCell(nodePath.getInt(i), nodePath.getInt(i - 1), rows));
        }
        return new SteppingStoneLoop(loop);
    }

    /**
     * Basic cell joining two adjacent tree nodes (one row node, one column node).
     */
    private static Cell toCell(int first, int second, int rows) {
        return first < rows
                ? new Cell(first, second - rows)
                : new Cell(second, first - rows);
    }
}
