package org.shipplan.transport.initial;

import lombok.extern.slf4j.Slf4j;
import org.shipplan.transport.core.InvariantViolationException;
import org.shipplan.transport.model.Allocation;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.TransportationProblem;

/**
 * North-West Corner initial allocation.
 *
 * <p>A cursor starts at (0,0) and walks a staircase toward (m-1,n-1). Each visited cell
 * ships {@code min(remaining supply, remaining demand)} and becomes basic. The cursor
 * moves down when the row's supply is exhausted, right when the column's demand is
 * exhausted. When both run out at once (and neither index is the last), a zero-valued
 * phantom cell is placed directly below the current cell and the cursor moves diagonally,
 * which keeps the staircase connected and the cell count at {@code m + n - 1}.</p>
 */
@Slf4j
public final class NorthWestCornerAllocator implements InitialAllocator {

    @Override
    public InitialBasis allocate(TransportationProblem problem, double zeroTolerance) {
        int rows = problem.rows();
        int columns = problem.columns();
        double[] remainingSupply = problem.supply();
        double[] remainingDemand = problem.demand();
        Allocation allocation = new Allocation(rows, columns);
        BasicCellSet basis = new BasicCellSet(rows, columns);
        int phantomCells = 0;

        int row = 0;
        int column = 0;
        while (true) {
            double quantity = Math.min(remainingSupply[row], remainingDemand[column]);
            Cell cell = new Cell(row, column);
            allocation.set(cell, quantity);
            basis.add(cell);
            remainingSupply[row] -= quantity;
            remainingDemand[column] -= quantity;

            boolean lastRow = row == rows - 1;
            boolean lastColumn = column == columns - 1;
            if (lastRow && lastColumn) {
                ensureFinalCellExhausted(remainingSupply[row], remainingDemand[column], zeroTolerance);
                break;
            }

            boolean supplyExhausted = Math.abs(remainingSupply[row]) <= zeroTolerance;
            boolean demandExhausted = Math.abs(remainingDemand[column]) <= zeroTolerance;
            if (supplyExhausted && demandExhausted && !lastRow && !lastColumn) {
                Cell phantom = new Cell(row + 1, column);
                allocation.set(phantom, 0.0d);
                basis.add(phantom);
                phantomCells++;
                row++;
                column++;
            } else if (supplyExhausted && !lastRow) {
                row++;
            } else if (demandExhausted && !lastColumn) {
                column++;
            } else {
                throw new InvariantViolationException(
                        InvariantViolationException.REASON_NWCM_EXHAUSTED,
                        "cursor stuck at " + cell + ": remaining supply " + remainingSupply[row]
                                + ", remaining demand " + remainingDemand[column]
                );
            }
        }

        if (!basis.hasTreeSize()) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_BASIS_SIZE,
                    "north-west corner produced " + basis.size() + " basic cells, expected " + problem.basisSize()
            );
        }
        if (phantomCells > 0) {
            log.debug("north-west corner inserted {} phantom cell(s) for degeneracy", phantomCells);
        }
        return new InitialBasis(allocation, basis, phantomCells);
    }

    private static void ensureFinalCellExhausted(double supplyLeft, double demandLeft, double zeroTolerance) {
        if (Math.abs(supplyLeft) > zeroTolerance || Math.abs(demandLeft) > zeroTolerance) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_NWCM_FINAL_CELL,
                    "final cell left supply " + supplyLeft + " and demand " + demandLeft + " unshipped"
            );
        }
    }
}
