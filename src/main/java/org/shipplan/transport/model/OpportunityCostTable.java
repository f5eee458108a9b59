package org.shipplan.transport.model;

import java.util.Arrays;

/**
 * Reduced costs {@code d(i,j)} for every non-basic cell; basic cells hold {@link Double#NaN}.
 */
public final class OpportunityCostTable {
    private final double[][] values;

    public OpportunityCostTable(double[][] values) {
        this.values = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            this.values[r] = values[r].clone();
        }
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return values[0].length;
    }

    /**
     * Reduced cost at one cell, or {@code NaN} when the cell is basic.
     */
    public double get(int row, int column) {
        return values[row][column];
    }

    public boolean isPriced(int row, int column) {
        return !Double.isNaN(values[row][column]);
    }

    /**
     * Smallest priced reduced cost, or {@code +INF} when every cell is basic.
     */
    public double minimum() {
        double min = Double.POSITIVE_INFINITY;
        for (double[] row : values) {
            for (double value : row) {
                if (!Double.isNaN(value) && value < min) {
                    min = value;
                }
            }
        }
        return min;
    }

    /**
     * Returns true when no priced cell is below {@code -tolerance}.
     */
    public boolean isOptimal(double tolerance) {
        return minimum() >= -tolerance;
    }

    /**
     * Returns a deep copy of the table.
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int r = 0; r < values.length; r++) {
            copy[r] = Arrays.copyOf(values[r], values[r].length);
        }
        return copy;
    }
}
