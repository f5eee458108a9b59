package org.shipplan.transport.modi;

import org.shipplan.transport.model.Cell;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Closed alternating loop through the entering cell and existing basic cells.
 *
 * <p>Cells are ordered around the loop starting at the entering cell. Consecutive cells
 * (including last to first) share a row or a column, alternating between the two.
 * Even positions carry {@link Sign#PLUS}, odd positions {@link Sign#MINUS}.</p>
 */
public final class SteppingStoneLoop {

    /**
     * Direction of the quantity shift applied to a loop cell.
     */
    public enum Sign {
        PLUS,
        MINUS
    }

    /**
     * One loop position.
     */
    public record Step(Cell cell, Sign sign) {
        public Step {
            Objects.requireNonNull(cell, "cell");
            Objects.requireNonNull(sign, "sign");
        }
    }

    private final List<Cell> cells;

    SteppingStoneLoop(List<Cell> cells) {
        if (cells.size() < 4 || cells.size() % 2 != 0) {
            throw new IllegalArgumentException("loop must have an even length >= 4, got " + cells.size());
        }
        for (int i = 0; i < cells.size(); i++) {
            Cell current = cells.get(i);
            Cell next = cells.get((i + 1) % cells.size());
            boolean linked = i % 2 == 0
                    ? current.sharesRow(next) && !current.sharesColumn(next)
                    : current.sharesColumn(next) && !current.sharesRow(next);
            if (!linked) {
                throw new IllegalArgumentException(
                        "loop step " + current + " -> " + next + " must move along a "
                                + (i % 2 == 0 ? "row" : "column")
                );
            }
        }
        this.cells = List.copyOf(cells);
    }

    /**
     * The entering cell (first loop position, always {@link Sign#PLUS}).
     */
    public Cell entering() {
        return cells.get(0);
    }

    public int length() {
        return cells.size();
    }

    public Cell cell(int position) {
        return cells.get(position);
    }

    public Sign sign(int position) {
        return position % 2 == 0 ? Sign.PLUS : Sign.MINUS;
    }

    /**
     * Loop cells in traversal order.
     */
    public List<Cell> cells() {
        return cells;
    }

    /**
     * Loop cells with their signs, in traversal order.
     */
    public List<Step> steps() {
        List<Step> steps = new ArrayList<>(cells.size());
        for (int i = 0; i < cells.size(); i++) {
            steps.add(new Step(cells.get(i), sign(i)));
        }
        return List.copyOf(steps);
    }

    /**
     * Cells that give up quantity, in traversal order.
     */
    public List<Cell> minusCells() {
        List<Cell> minus = new ArrayList<>(cells.size() / 2);
        for (int i = 1; i < cells.size(); i += 2) {
            minus.add(cells.get(i));
        }
        return minus;
    }
}
