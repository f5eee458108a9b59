package org.shipplan.transport.modi;

import org.shipplan.transport.core.InvariantViolationException;
import org.shipplan.transport.core.NonConvergenceException;
import org.shipplan.transport.core.SolverConfig;
import org.shipplan.transport.initial.InitialBasis;
import org.shipplan.transport.initial.NorthWestCornerAllocator;
import org.shipplan.transport.model.Allocation;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.TransportationProblem;
import org.shipplan.transport.testutil.TransportFixtureFactory;
import org.shipplan.transport.trace.InitialRecord;
import org.shipplan.transport.trace.IterationRecord;
import org.shipplan.transport.trace.SolveStatus;
import org.shipplan.transport.trace.SolveTrace;
import org.shipplan.transport.trace.StepListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Reoptimizer Tests")
class ReoptimizerTest {
    private static final double EPS = TransportFixtureFactory.EPS;
    private static final SolverConfig DEFAULT_CONFIG = SolverConfig.builder().build();

    @Test
    @DisplayName("Textbook: one pivot moves 20 units onto (0,2), cost 1130 -> 1110")
    void testTextbookSinglePivot() {
        Run run = Run.start(TransportFixtureFactory.textbook(), DEFAULT_CONFIG);

        ReoptimizationResult result = run.execute();

        assertEquals(1, result.iterations());
        IterationRecord record = result.trace().iterations().get(0);
        assertEquals(1, record.getIteration());
        assertEquals(new Cell(0, 2), record.getEntering());
        assertEquals(-1.0d, record.getEnteringOpportunityCost(), 1e-12d);
        assertEquals(20.0d, record.getShiftQuantity(), 0.0d);
        assertEquals(new Cell(0, 1), record.getLeaving());
        assertEquals(1110.0d, record.getTotalCost(), 1e-9d);
        assertEquals(4, record.getLoop().size());
        assertEquals(SteppingStoneLoop.Sign.MINUS, record.getLoop().get(3).sign());
        assertArrayEquals(new double[]{0.0d, -2.0d}, record.getPotentials().rowPotentials(), 1e-12d);

        assertArrayEquals(new double[]{80, 0, 20}, run.allocation.snapshot()[0], 1e-12d);
        assertArrayEquals(new double[]{0, 70, 50}, run.allocation.snapshot()[1], 1e-12d);
        assertEquals(
                List.of(new Cell(0, 0), new Cell(0, 2), new Cell(1, 1), new Cell(1, 2)),
                run.basis.cells()
        );
        assertArrayEquals(new double[]{0.0d, -1.0d}, result.potentials().rowPotentials(), 1e-12d);
        assertArrayEquals(new double[]{4.0d, 5.0d, 8.0d}, result.potentials().columnPotentials(), 1e-12d);
        assertTrue(result.opportunityCosts().isOptimal(EPS));
        assertEquals(SolveStatus.OPTIMAL, result.trace().status());
        assertEquals(1110.0d, result.trace().finalCost(), 1e-9d);
    }

    @Test
    @DisplayName("3x4: two pivots reach the optimum 743")
    void testThreeByFour() {
        Run run = Run.start(TransportFixtureFactory.threeByFour(), DEFAULT_CONFIG);

        ReoptimizationResult result = run.execute();

        List<IterationRecord> records = result.trace().iterations();
        assertEquals(2, records.size());
        assertEquals(new Cell(2, 1), records.get(0).getEntering());
        assertEquals(-52.0d, records.get(0).getEnteringOpportunityCost(), 1e-9d);
        assertEquals(4.0d, records.get(0).getShiftQuantity(), 0.0d);
        assertEquals(new Cell(2, 2), records.get(0).getLeaving());
        assertEquals(807.0d, records.get(0).getTotalCost(), 1e-9d);
        assertEquals(new Cell(0, 3), records.get(1).getEntering());
        assertEquals(new Cell(0, 1), records.get(1).getLeaving());
        assertEquals(743.0d, records.get(1).getTotalCost(), 1e-9d);

        double[][] expected = {{5, 0, 0, 2}, {0, 2, 7, 0}, {0, 6, 0, 12}};
        double[][] actual = run.allocation.snapshot();
        for (int r = 0; r < expected.length; r++) {
            assertArrayEquals(expected[r], actual[r], 1e-12d);
        }
    }

    @Test
    @DisplayName("Degenerate pivot with theta = 0 still swaps the basis and keeps the cost")
    void testZeroShiftPivot() {
        Run run = Run.start(TransportFixtureFactory.zeroShift(), DEFAULT_CONFIG);

        ReoptimizationResult result = run.execute();

        IterationRecord record = result.trace().iterations().get(0);
        assertEquals(new Cell(0, 1), record.getEntering());
        assertEquals(0.0d, record.getShiftQuantity(), 0.0d);
        assertEquals(new Cell(0, 0), record.getLeaving());
        assertEquals(100.0d, record.getTotalCost(), 1e-9d);
        assertEquals(100.0d, result.trace().initial().getTotalCost(), 1e-9d);
        assertTrue(run.basis.contains(0, 1));
        assertEquals(4, run.basis.size());
    }

    @Test
    @DisplayName("Leaving tie: lowest index leaves, the other stays basic at zero")
    void testLeavingTieLowestIndex() {
        Run run = Run.start(TransportFixtureFactory.leavingTie(), DEFAULT_CONFIG);

        ReoptimizationResult result = run.execute();

        IterationRecord record = result.trace().iterations().get(0);
        assertEquals(new Cell(1, 0), record.getEntering());
        assertEquals(5.0d, record.getShiftQuantity(), 0.0d);
        assertEquals(new Cell(0, 0), record.getLeaving());
        assertTrue(run.basis.contains(1, 1));
        assertEquals(0.0d, run.allocation.get(1, 1), 0.0d);
        assertEquals(4, run.basis.size());
        assertEquals(150.0d, result.trace().finalCost(), 1e-9d);
    }

    @Test
    @DisplayName("Leaving tie: HIGHEST_INDEX policy removes the later cell instead")
    void testLeavingTieHighestIndex() {
        SolverConfig config = SolverConfig.builder().leavingTieBreak(TieBreakPolicy.HIGHEST_INDEX).build();
        Run run = Run.start(TransportFixtureFactory.leavingTie(), config);

        ReoptimizationResult result = run.execute();

        assertEquals(new Cell(1, 1), result.trace().iterations().get(0).getLeaving());
        assertTrue(run.basis.contains(0, 0));
        assertEquals(0.0d, run.allocation.get(0, 0), 0.0d);
        assertEquals(150.0d, result.trace().finalCost(), 1e-9d);
    }

    @Test
    @DisplayName("Staircase degeneracy: phantom cells pivot out and the optimum is 78")
    void testStaircaseDegenerate() {
        Run run = Run.start(TransportFixtureFactory.staircaseDegenerate(), DEFAULT_CONFIG);

        ReoptimizationResult result = run.execute();

        assertEquals(2, result.iterations());
        assertEquals(98.0d, result.trace().initial().getTotalCost(), 1e-9d);
        assertEquals(78.0d, result.trace().finalCost(), 1e-9d);
        TransportFixtureFactory.assertMarginals(run.problem, run.allocation);
    }

    @Test
    @DisplayName("Iteration cap reached first: NonConvergenceException carries the best plan so far")
    void testNonConvergence() {
        SolverConfig config = SolverConfig.builder().maxIterations(1).build();
        Run run = Run.start(TransportFixtureFactory.threeByFour(), config);

        NonConvergenceException ex = assertThrows(NonConvergenceException.class, run::execute);

        assertEquals(NonConvergenceException.REASON_NON_CONVERGENCE, ex.getReasonCode());
        assertEquals(1, ex.iterations());
        assertEquals(807.0d, ex.bestTotalCost(), 1e-9d);
        assertEquals(SolveStatus.NON_CONVERGED, ex.trace().status());
        assertEquals(1, ex.trace().iterations().size());
        TransportFixtureFactory.assertMarginals(run.problem, ex.bestAllocation());
        assertEquals(1, run.finished.size());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    @DisplayName("Random instances: marginals, basis size and monotone cost hold after every pivot")
    void testRandomPivotInvariants() {
        Random random = new Random(42L);
        for (int trial = 0; trial < 300; trial++) {
            int rows = 1 + random.nextInt(6);
            int columns = 1 + random.nextInt(6);
            Run run = Run.start(
                    TransportFixtureFactory.randomBalanced(random, rows, columns, 20, random.nextInt(60)),
                    DEFAULT_CONFIG
            );
            double[] previousCost = {run.initial.getTotalCost()};
            run.pivotCheck = record -> {
                TransportFixtureFactory.assertMarginals(run.problem, run.allocation);
                assertEquals(rows + columns - 1, run.basis.size());
                assertTrue(record.getTotalCost() <= previousCost[0] + 1e-9d, "cost increased");
                if (record.getShiftQuantity() > EPS) {
                    assertTrue(record.getTotalCost() < previousCost[0], "positive shift did not lower cost");
                }
                previousCost[0] = record.getTotalCost();
            };

            ReoptimizationResult result = run.execute();

            assertTrue(result.iterations() <= DEFAULT_CONFIG.iterationCap(rows, columns));
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < columns; c++) {
                    if (result.opportunityCosts().isPriced(r, c)) {
                        assertTrue(result.opportunityCosts().get(r, c) >= -EPS, "d < 0 at optimum");
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Random 2 x n instances match exhaustive enumeration")
    void testTwoRowOptimumMatchesEnumeration() {
        Random random = new Random(2024L);
        for (int trial = 0; trial < 120; trial++) {
            TransportFixtureFactory.Instance instance = TransportFixtureFactory
                    .randomBalanced(random, 2, 2 + random.nextInt(3), 15, random.nextInt(25));
            Run run = Run.start(instance, DEFAULT_CONFIG);

            ReoptimizationResult result = run.execute();

            assertEquals(
                    TransportFixtureFactory.bruteForceTwoRowOptimum(instance),
                    result.trace().finalCost(),
                    1e-6d,
                    "trial " + trial
            );
        }
    }

    @Test
    @DisplayName("Corrupted loop quantity leaves no leaving candidate and fails the pivot")
    void testNoLeavingCell() {
        Run run = Run.start(TransportFixtureFactory.textbook(), DEFAULT_CONFIG);
        run.allocation.set(new Cell(0, 1), Double.NaN);
        run.allocation.set(new Cell(1, 2), Double.NaN);

        InvariantViolationException ex = assertThrows(InvariantViolationException.class, run::execute);

        assertEquals(InvariantViolationException.REASON_NO_LEAVING_CELL, ex.getReasonCode());
        assertTrue(run.seen.isEmpty());
    }

    @Test
    @DisplayName("Listener sees every pivot in order, then the finished trace")
    void testListenerOrdering() {
        Run run = Run.start(TransportFixtureFactory.threeByFour(), DEFAULT_CONFIG);

        ReoptimizationResult result = run.execute();

        assertEquals(2, run.seen.size());
        assertEquals(1, run.seen.get(0).getIteration());
        assertEquals(2, run.seen.get(1).getIteration());
        assertEquals(1, run.finished.size());
        assertSame(result.trace(), run.finished.get(0));
    }

    /**
     * One reoptimizer run over a fresh north-west corner start.
     */
    private static final class Run implements StepListener {
        final TransportationProblem problem;
        final Allocation allocation;
        final BasicCellSet basis;
        final InitialRecord initial;
        final SolverConfig config;
        final List<IterationRecord> seen = new ArrayList<>();
        final List<SolveTrace> finished = new ArrayList<>();
        Consumer<IterationRecord> pivotCheck = record -> {
        };

        private Run(TransportationProblem problem, InitialBasis start, SolverConfig config) {
            this.problem = problem;
            this.allocation = start.allocation();
            this.basis = start.basis();
            this.config = config;
            this.initial = InitialRecord.builder()
                    .allocation(allocation.snapshot())
                    .basicCells(basis.cells())
                    .phantomCells(start.phantomCells())
                    .totalCost(allocation.totalCost(problem))
                    .build();
        }

        static Run start(TransportFixtureFactory.Instance instance, SolverConfig config) {
            TransportationProblem problem = instance.problem();
            return new Run(problem, new NorthWestCornerAllocator().allocate(problem, EPS), config);
        }

        ReoptimizationResult execute() {
            return new Reoptimizer().run(problem, allocation, basis, initial, config, this);
        }

        @Override
        public void onIteration(IterationRecord record) {
            seen.add(record);
            pivotCheck.accept(record);
        }

        @Override
        public void onFinish(SolveTrace trace) {
            finished.add(trace);
        }
    }
}
