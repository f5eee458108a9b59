package org.shipplan.transport.validation;

import lombok.experimental.UtilityClass;
import org.shipplan.core.id.SiteIndex;
import org.shipplan.transport.core.BalanceException;
import org.shipplan.transport.core.ShapeException;
import org.shipplan.transport.model.TransportationProblem;

import java.util.List;

/**
 * Entry gate for caller-supplied cost/supply/demand data.
 *
 * <p>Checks run in a fixed order: presence, dimensions, value domain, labels, balance.
 * The first failure wins; nothing is allocated before every check passes.</p>
 */
@UtilityClass
public final class ProblemValidator {

    public static final String DEFAULT_WAREHOUSE_PREFIX = "Warehouse";
    public static final String DEFAULT_DESTINATION_PREFIX = "Dest";

    /**
     * Validates raw inputs and builds an immutable problem.
     *
     * @param costs m x n unit costs, row = warehouse.
     * @param supply m supplies.
     * @param demand n demands.
     * @param warehouseLabels optional labels for rows; {@code null} or empty means numbered defaults.
     * @param destinationLabels optional labels for columns; {@code null} or empty means numbered defaults.
     * @param balanceTolerance relative tolerance for the balance check.
     * @return validated problem.
     * @throws ShapeException on missing input, dimension mismatch, invalid values or labels.
     * @throws BalanceException when total supply differs from total demand.
     */
    public static TransportationProblem validate(
            double[][] costs,
            double[] supply,
            double[] demand,
            List<String> warehouseLabels,
            List<String> destinationLabels,
            double balanceTolerance
    ) {
        checkShape(costs, supply, demand);
        checkValues(costs, supply, demand);
        SiteIndex warehouses = resolveLabels(warehouseLabels, supply.length, DEFAULT_WAREHOUSE_PREFIX, "warehouse");
        SiteIndex destinations = resolveLabels(destinationLabels, demand.length, DEFAULT_DESTINATION_PREFIX, "destination");
        checkBalance(supply, demand, balanceTolerance);
        return TransportationProblem.of(costs, supply, demand, warehouses, destinations);
    }

    /**
     * Verifies presence and dimensions: m > 0, n > 0, rectangular matrix, vector lengths.
     */
    public static void checkShape(double[][] costs, double[] supply, double[] demand) {
        if (costs == null || supply == null || demand == null) {
            throw new ShapeException(ShapeException.REASON_NULL_INPUT, "costs, supply and demand are required");
        }
        if (costs.length == 0 || costs[0] == null || costs[0].length == 0) {
            throw new ShapeException(ShapeException.REASON_EMPTY, "cost matrix must have at least one row and one column");
        }
        int columns = costs[0].length;
        for (int r = 0; r < costs.length; r++) {
            if (costs[r] == null || costs[r].length != columns) {
                throw new ShapeException(
                        ShapeException.REASON_RAGGED,
                        "cost row " + r + " has " + (costs[r] == null ? "no" : costs[r].length)
                                + " columns, expected " + columns
                );
            }
        }
        if (supply.length != costs.length) {
            throw new ShapeException(
                    ShapeException.REASON_SUPPLY_LENGTH,
                    "supply has " + supply.length + " entries, cost matrix has " + costs.length + " rows"
            );
        }
        if (demand.length != columns) {
            throw new ShapeException(
                    ShapeException.REASON_DEMAND_LENGTH,
                    "demand has " + demand.length + " entries, cost matrix has " + columns + " columns"
            );
        }
    }

    /**
     * Verifies sum(supply) == sum(demand) within {@code tolerance * max(1, |supply|, |demand|)}.
     *
     * @throws ShapeException when either total overflows to a non-finite value.
     * @throws BalanceException when the totals differ beyond tolerance.
     */
    public static void checkBalance(double[] supply, double[] demand, double tolerance) {
        double supplyTotal = 0.0d;
        for (double value : supply) {
            supplyTotal += value;
        }
        double demandTotal = 0.0d;
        for (double value : demand) {
            demandTotal += value;
        }
        if (!Double.isFinite(supplyTotal) || !Double.isFinite(demandTotal)) {
            throw new ShapeException(
                    ShapeException.REASON_NON_FINITE,
                    "supply total " + supplyTotal + " and demand total " + demandTotal + " must both be finite"
            );
        }
        double scale = Math.max(1.0d, Math.max(Math.abs(supplyTotal), Math.abs(demandTotal)));
        if (!(Math.abs(supplyTotal - demandTotal) <= tolerance * scale)) {
            throw new BalanceException(supplyTotal, demandTotal);
        }
    }

    private static void checkValues(double[][] costs, double[] supply, double[] demand) {
        for (int r = 0; r < costs.length; r++) {
            for (int c = 0; c < costs[r].length; c++) {
                double cost = costs[r][c];
                requireFinite(cost, "cost(" + r + "," + c + ")");
                if (cost < 0.0d) {
                    throw new ShapeException(
                            ShapeException.REASON_NEGATIVE_COST,
                            "cost(" + r + "," + c + ") must be >= 0, got " + cost
                    );
                }
            }
        }
        for (int r = 0; r < supply.length; r++) {
            requireFinite(supply[r], "supply[" + r + "]");
            if (supply[r] < 0.0d) {
                throw new ShapeException(
                        ShapeException.REASON_NEGATIVE_SUPPLY,
                        "supply[" + r + "] must be >= 0, got " + supply[r]
                );
            }
        }
        for (int c = 0; c < demand.length; c++) {
            requireFinite(demand[c], "demand[" + c + "]");
            if (demand[c] < 0.0d) {
                throw new ShapeException(
                        ShapeException.REASON_NEGATIVE_DEMAND,
                        "demand[" + c + "] must be >= 0, got " + demand[c]
                );
            }
        }
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new ShapeException(ShapeException.REASON_NON_FINITE, name + " must be finite, got " + value);
        }
    }

    private static SiteIndex resolveLabels(List<String> labels, int expected, String defaultPrefix, String side) {
        if (labels == null || labels.isEmpty()) {
            return SiteIndex.numbered(defaultPrefix, expected);
        }
        if (labels.size() != expected) {
            throw new ShapeException(
                    ShapeException.REASON_LABEL_INVALID,
                    side + " labels has " + labels.size() + " entries, expected " + expected
            );
        }
        try {
            return SiteIndex.of(labels);
        } catch (IllegalArgumentException ex) {
            throw new ShapeException(ShapeException.REASON_LABEL_INVALID, side + " labels: " + ex.getMessage(), ex);
        }
    }
}
