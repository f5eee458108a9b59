package org.shipplan.transport.trace;

import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.TransportationProblem;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of the shipment summary: what moves from which warehouse to which destination.
 *
 * @param from warehouse label.
 * @param to destination label.
 * @param cell grid position.
 * @param quantity shipped quantity.
 * @param unitCost cost per unit on this route.
 */
public record ShipmentLine(String from, String to, Cell cell, double quantity, double unitCost) {

    public double subtotal() {
        return quantity * unitCost;
    }

    /**
     * Lists every cell shipping more than {@code tolerance}, row-major.
     */
    public static List<ShipmentLine> linesOf(TransportationProblem problem, double[][] allocation, double tolerance) {
        List<ShipmentLine> lines = new ArrayList<>();
        for (int r = 0; r < problem.rows(); r++) {
            for (int c = 0; c < problem.columns(); c++) {
                double quantity = allocation[r][c];
                if (quantity > tolerance) {
                    lines.add(new ShipmentLine(
                            problem.warehouses().toLabel(r),
                            problem.destinations().toLabel(c),
                            new Cell(r, c),
                            quantity,
                            problem.cost(r, c)
                    ));
                }
            }
        }
        return List.copyOf(lines);
    }
}
