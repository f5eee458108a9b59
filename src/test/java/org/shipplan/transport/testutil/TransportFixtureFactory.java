package org.shipplan.transport.testutil;

import org.shipplan.transport.model.Allocation;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.TransportationProblem;
import org.shipplan.transport.validation.ProblemValidator;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Shared instances for transportation solver tests.
 */
public final class TransportFixtureFactory {
    public static final double EPS = 1e-9d;

    private TransportFixtureFactory() {
    }

    public record Instance(double[][] costs, double[] supply, double[] demand) {

        public TransportationProblem problem() {
            return ProblemValidator.validate(costs, supply, demand, null, null, EPS);
        }
    }

    /**
     * 2x3 textbook instance: NWCM cost 1130, optimum 1110 after one pivot.
     */
    public static Instance textbook() {
        return new Instance(
                new double[][]{{4, 6, 8}, {5, 4, 7}},
                new double[]{100, 120},
                new double[]{80, 70, 70}
        );
    }

    /**
     * 3x4 instance: NWCM cost 1015, optimum 743 after two pivots.
     */
    public static Instance threeByFour() {
        return new Instance(
                new double[][]{{19, 30, 50, 10}, {70, 30, 40, 60}, {40, 8, 70, 20}},
                new double[]{7, 9, 18},
                new double[]{5, 8, 7, 14}
        );
    }

    /**
     * 2x2 instance whose first NWCM step exhausts row and column together.
     */
    public static Instance degenerateTwoByTwo() {
        return new Instance(
                new double[][]{{1, 2}, {3, 4}},
                new double[]{10, 10},
                new double[]{10, 10}
        );
    }

    /**
     * 3x3 instance with two simultaneous exhaustions during NWCM: optimum 78.
     */
    public static Instance staircaseDegenerate() {
        return new Instance(
                new double[][]{{2, 3, 1}, {5, 4, 8}, {5, 6, 8}},
                new double[]{5, 8, 7},
                new double[]{5, 8, 7}
        );
    }

    /**
     * 3x2 instance whose only pivot shifts zero units.
     */
    public static Instance zeroShift() {
        return new Instance(
                new double[][]{{2, 4}, {1, 7}, {1, 4}},
                new double[]{0, 20, 5},
                new double[]{10, 15}
        );
    }

    /**
     * 3x2 instance whose first pivot empties two loop cells at once.
     */
    public static Instance leavingTie() {
        return new Instance(
                new double[][]{{3, 1}, {6, 8}, {9, 7}},
                new double[]{15, 5, 15},
                new double[]{5, 30}
        );
    }

    /**
     * Seeded random balanced instance with integer costs and quantities.
     *
     * <p>Quantities are split from a common total so ties and zero entries are frequent.</p>
     */
    public static Instance randomBalanced(Random random, int rows, int columns, int maxCost, int total) {
        double[][] costs = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                costs[r][c] = random.nextInt(maxCost + 1);
            }
        }
        return new Instance(costs, split(random, total, rows), split(random, total, columns));
    }

    /**
     * Builds a basis from explicit cells.
     */
    public static BasicCellSet basisOf(int rows, int columns, List<Cell> cells) {
        BasicCellSet basis = new BasicCellSet(rows, columns);
        for (Cell cell : cells) {
            basis.add(cell);
        }
        return basis;
    }

    public static void assertMarginals(TransportationProblem problem, Allocation allocation) {
        assertMarginals(problem, allocation.snapshot());
    }

    /**
     * Asserts every row sums to its supply and every column to its demand.
     */
    public static void assertMarginals(TransportationProblem problem, double[][] allocation) {
        for (int r = 0; r < problem.rows(); r++) {
            double total = 0.0d;
            for (int c = 0; c < problem.columns(); c++) {
                if (allocation[r][c] < -EPS) {
                    throw new AssertionError("negative quantity at (" + r + "," + c + "): " + allocation[r][c]);
                }
                total += allocation[r][c];
            }
            if (Math.abs(total - problem.supply(r)) > 1e-6d) {
                throw new AssertionError("row " + r + " ships " + total + ", supply " + problem.supply(r));
            }
        }
        for (int c = 0; c < problem.columns(); c++) {
            double total = 0.0d;
            for (int r = 0; r < problem.rows(); r++) {
                total += allocation[r][c];
            }
            if (Math.abs(total - problem.demand(c)) > 1e-6d) {
                throw new AssertionError("column " + c + " receives " + total + ", demand " + problem.demand(c));
            }
        }
    }

    /**
     * Exact optimum of a 2 x n integer instance by enumerating the first row.
     */
    public static double bruteForceTwoRowOptimum(Instance instance) {
        double[][] costs = instance.costs();
        double[] demand = instance.demand();
        int columns = demand.length;
        int[] firstRow = new int[columns];
        double[] best = {Double.POSITIVE_INFINITY};
        enumerate(costs, demand, (int) instance.supply()[0], firstRow, 0, best);
        return best[0];
    }

    private static void enumerate(double[][] costs, double[] demand, int remaining, int[] firstRow, int column, double[] best) {
        if (column == demand.length) {
            if (remaining != 0) {
                return;
            }
            double cost = 0.0d;
            for (int c = 0; c < demand.length; c++) {
                cost += firstRow[c] * costs[0][c] + (demand[c] - firstRow[c]) * costs[1][c];
            }
            best[0] = Math.min(best[0], cost);
            return;
        }
        int limit = Math.min(remaining, (int) demand[column]);
        for (int q = 0; q <= limit; q++) {
            firstRow[column] = q;
            enumerate(costs, demand, remaining - q, firstRow, column + 1, best);
        }
    }

    private static double[] split(Random random, int total, int parts) {
        int[] cuts = new int[parts + 1];
        cuts[parts] = total;
        for (int i = 1; i < parts; i++) {
            cuts[i] = random.nextInt(total + 1);
        }
        Arrays.sort(cuts, 1, parts);
        double[] values = new double[parts];
        for (int i = 0; i < parts; i++) {
            values[i] = cuts[i + 1] - cuts[i];
        }
        return values;
    }
}
