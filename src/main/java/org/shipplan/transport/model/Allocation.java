package org.shipplan.transport.model;

/**
 * Mutable m x n grid of shipped quantities owned by one running solve.
 *
 * <p>Not thread-safe. The reoptimizer mutates it in place; results leave the solve
 * only as {@link #snapshot()} copies.</p>
 */
public final class Allocation {
    private final int rows;
    private final int columns;
    private final double[][] quantities;

    public Allocation(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("allocation dimensions must be > 0, got " + rows + "x" + columns);
        }
        this.rows = rows;
        this.columns = columns;
        this.quantities = new double[rows][columns];
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public double get(int row, int column) {
        return quantities[row][column];
    }

    public double get(Cell cell) {
        return quantities[cell.row()][cell.column()];
    }

    public void set(Cell cell, double quantity) {
        quantities[cell.row()][cell.column()] = quantity;
    }

    /**
     * Adds {@code delta} (possibly negative) to one cell.
     */
    public void add(Cell cell, double delta) {
        quantities[cell.row()][cell.column()] += delta;
    }

    public double rowSum(int row) {
        double total = 0.0d;
        for (int c = 0; c < columns; c++) {
            total += quantities[row][c];
        }
        return total;
    }

    public double columnSum(int column) {
        double total = 0.0d;
        for (int r = 0; r < rows; r++) {
            total += quantities[r][column];
        }
        return total;
    }

    /**
     * Sum of quantity x unit cost over every cell.
     */
    public double totalCost(TransportationProblem problem) {
        double total = 0.0d;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                total += quantities[r][c] * problem.cost(r, c);
            }
        }
        return total;
    }

    /**
     * Returns a detached deep copy of the quantity grid.
     */
    public double[][] snapshot() {
        double[][] copy = new double[rows][];
        for (int r = 0; r < rows; r++) {
            copy[r] = quantities[r].clone();
        }
        return copy;
    }
}
