package org.shipplan.transport.model;

/**
 * One (warehouse row, destination column) position in the cost/allocation grid.
 *
 * <p>Natural order is row-major: lower row first, then lower column.</p>
 */
public record Cell(int row, int column) implements Comparable<Cell> {

    public Cell {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("cell indices must be >= 0, got (" + row + "," + column + ")");
        }
    }

    /**
     * Returns true when both cells sit in the same row.
     */
    public boolean sharesRow(Cell other) {
        return row == other.row;
    }

    /**
     * Returns true when both cells sit in the same column.
     */
    public boolean sharesColumn(Cell other) {
        return column == other.column;
    }

    @Override
    public int compareTo(Cell other) {
        int byRow = Integer.compare(row, other.row);
        return byRow != 0 ? byRow : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
