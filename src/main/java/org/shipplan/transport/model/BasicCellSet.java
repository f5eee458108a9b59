package org.shipplan.transport.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Index-based set of basic cells with adjacency lookups by row and by column.
 *
 * <p>The set is read as a bipartite graph: row nodes and column nodes joined by one edge
 * per basic cell. A well-formed basis has exactly {@code m + n - 1} cells and forms a
 * spanning tree over the {@code m + n} nodes. No node objects are allocated; membership
 * lives in a bit set indexed {@code row * columns + column} and adjacency in sorted
 * primitive lists.</p>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe; owned by a single solve.</p>
 */
public final class BasicCellSet {
    private final int rows;
    private final int columns;
    private final BitSet members;
    // byRow[r] = sorted columns of basic cells in row r
    private final IntArrayList[] byRow;
    // byColumn[c] = sorted rows of basic cells in column c
    private final IntArrayList[] byColumn;
    private int size;

    public BasicCellSet(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("basis dimensions must be > 0, got " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.members = new BitSet(rows * columns);
        this.byRow = new IntArrayList[rows];
        this.byColumn = new IntArrayList[columns];
        for (int r = 0; r < rows; r++) {
            byRow[r] = new IntArrayList();
        }
        for (int c = 0; c < columns; c++) {
            byColumn[c] = new IntArrayList();
        }
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int size() {
        return size;
    }

    /**
     * Returns true when the cell count equals {@code rows + columns - 1}.
     */
    public boolean hasTreeSize() {
        return size == rows + columns - 1;
    }

    public boolean contains(int row, int column) {
        checkBounds(row, column);
        return members.get(slot(row, column));
    }

    public boolean contains(Cell cell) {
        return contains(cell.row(), cell.column());
    }

    /**
     * Marks a cell basic.
     *
     * @return true when the cell was not basic before.
     */
    public boolean add(Cell cell) {
        int row = cell.row();
        int column = cell.column();
        checkBounds(row, column);
        int slot = slot(row, column);
        if (members.get(slot)) {
            return false;
        }
        members.set(slot);
        insertSorted(byRow[row], column);
        insertSorted(byColumn[column], row);
        size++;
        return true;
    }

    /**
     * Removes a cell from the basis.
     *
     * @return true when the cell was basic before.
     */
    public boolean remove(Cell cell) {
        int row = cell.row();
        int column = cell.column();
        checkBounds(row, column);
        int slot = slot(row, column);
        if (!members.get(slot)) {
            return false;
        }
        members.clear(slot);
        byRow[row].rem(column);
        byColumn[column].rem(row);
        size--;
        return true;
    }

    /**
     * Columns of the basic cells in one row, ascending. Read-only view.
     */
    public IntList columnsInRow(int row) {
        return IntLists.unmodifiable(byRow[row]);
    }

    /**
     * Rows of the basic cells in one column, ascending. Read-only view.
     */
    public IntList rowsInColumn(int column) {
        return IntLists.unmodifiable(byColumn[column]);
    }

    /**
     * All basic cells in row-major order.
     */
    public List<Cell> cells() {
        List<Cell> cells = new ArrayList<>(size);
        for (int r = 0; r < rows; r++) {
            IntArrayList rowColumns = byRow[r];
            for (int i = 0; i < rowColumns.size(); i++) {
                cells.add(new Cell(r, rowColumns.getInt(i)));
            }
        }
        return cells;
    }

    private int slot(int row, int column) {
        return row * columns + column;
    }

    private void checkBounds(int row, int column) {
        if (row < 0 || row >= rows || column < 0 || column >= columns) {
            throw new IndexOutOfBoundsException(
                    "cell (" + row + "," + column + ") outside " + rows + "x" + columns + " grid"
            );
        }
    }

    private static void insertSorted(IntArrayList list, int value) {
        int index = 0;
        while (index < list.size() && list.getInt(index) < value) {
            index++;
        }
        list.add(index, value);
    }
}
