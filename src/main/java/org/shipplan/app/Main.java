package org.shipplan.app;

import org.shipplan.transport.core.TransportationPlan;
import org.shipplan.transport.core.TransportationSolver;
import org.shipplan.transport.trace.LoggingStepListener;
import org.shipplan.transport.trace.ShipmentLine;

import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {
    /**
     * Solves the two-warehouse, three-destination textbook instance and prints the plan.
     *
     * @param args command-line arguments (ignored).
     */
    public static void main(String[] args) {
        TransportationSolver solver = TransportationSolver.builder()
                .listener(new LoggingStepListener())
                .build();
        TransportationPlan plan = solver.solve(
                new double[][]{{4, 6, 8}, {5, 4, 7}},
                new double[]{100, 120},
                new double[]{80, 70, 70}
        );

        System.out.printf(Locale.ROOT, "%-12s %-8s %10s %10s %10s%n", "From", "To", "Quantity", "Unit Cost", "Subtotal");
        for (ShipmentLine line : plan.getShipments()) {
            System.out.printf(Locale.ROOT, "%-12s %-8s %10.0f %10.2f %10.2f%n",
                    line.from(), line.to(), line.quantity(), line.unitCost(), line.subtotal());
        }
        System.out.printf(Locale.ROOT, "MINIMUM TOTAL COST: %.2f%n", plan.getTotalCost());
    }
}
