package org.shipplan.transport.model;

/**
 * Row (u) and column (v) dual potentials with {@code u[0] = 0}.
 *
 * <p>Satisfy {@code u[i] + v[j] = cost(i, j)} on every basic cell. Immutable.</p>
 */
public final class Potentials {
    private final double[] u;
    private final double[] v;

    public Potentials(double[] u, double[] v) {
        this.u = u.clone();
        this.v = v.clone();
    }

    public double u(int row) {
        return u[row];
    }

    public double v(int column) {
        return v[column];
    }

    public double[] rowPotentials() {
        return u.clone();
    }

    public double[] columnPotentials() {
        return v.clone();
    }

    /**
     * Reduced cost {@code cost - (u[row] + v[column])}.
     */
    public double reducedCost(double cost, int row, int column) {
        return cost - (u[row] + v[column]);
    }
}
