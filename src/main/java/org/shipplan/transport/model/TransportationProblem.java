package org.shipplan.transport.model;

import org.shipplan.core.id.SiteIndex;

import java.util.Objects;

/**
 * Validated, immutable balanced transportation instance.
 *
 * <p>Holds the m x n cost matrix, the supply vector (length m), the demand vector
 * (length n) and the site labels for both sides. Instances are produced by the
 * validator after shape and balance checks; every accessor returns copies or scalars.</p>
 */
public final class TransportationProblem {
    private final double[][] costs;
    private final double[] supply;
    private final double[] demand;
    private final double totalSupply;
    private final double totalDemand;
    private final SiteIndex warehouses;
    private final SiteIndex destinations;

    private TransportationProblem(
            double[][] costs,
            double[] supply,
            double[] demand,
            SiteIndex warehouses,
            SiteIndex destinations
    ) {
        this.costs = costs;
        this.supply = supply;
        this.demand = demand;
        this.totalSupply = sum(supply);
        this.totalDemand = sum(demand);
        this.warehouses = warehouses;
        this.destinations = destinations;
    }

    /**
     * Creates an instance from already-validated inputs, copying every array.
     *
     * <p>Callers outside the validator should go through
     * {@link org.shipplan.transport.validation.ProblemValidator#validate}.</p>
     */
    public static TransportationProblem of(
            double[][] costs,
            double[] supply,
            double[] demand,
            SiteIndex warehouses,
            SiteIndex destinations
    ) {
        Objects.requireNonNull(costs, "costs");
        double[][] costCopy = new double[costs.length][];
        for (int i = 0; i < costs.length; i++) {
            costCopy[i] = costs[i].clone();
        }
        return new TransportationProblem(
                costCopy,
                Objects.requireNonNull(supply, "supply").clone(),
                Objects.requireNonNull(demand, "demand").clone(),
                Objects.requireNonNull(warehouses, "warehouses"),
                Objects.requireNonNull(destinations, "destinations")
        );
    }

    /** Number of warehouses (m). */
    public int rows() {
        return supply.length;
    }

    /** Number of destinations (n). */
    public int columns() {
        return demand.length;
    }

    /** Required basis size m + n - 1. */
    public int basisSize() {
        return rows() + columns() - 1;
    }

    public double cost(int row, int column) {
        return costs[row][column];
    }

    public double cost(Cell cell) {
        return costs[cell.row()][cell.column()];
    }

    public double supply(int row) {
        return supply[row];
    }

    public double demand(int column) {
        return demand[column];
    }

    public double[] supply() {
        return supply.clone();
    }

    public double[] demand() {
        return demand.clone();
    }

    public double[][] costs() {
        double[][] copy = new double[costs.length][];
        for (int i = 0; i < costs.length; i++) {
            copy[i] = costs[i].clone();
        }
        return copy;
    }

    public double totalSupply() {
        return totalSupply;
    }

    public double totalDemand() {
        return totalDemand;
    }

    public SiteIndex warehouses() {
        return warehouses;
    }

    public SiteIndex destinations() {
        return destinations;
    }

    private static double sum(double[] values) {
        double total = 0.0d;
        for (double value : values) {
            total += value;
        }
        return total;
    }
}
