package org.shipplan.transport.modi;

import lombok.extern.slf4j.Slf4j;
import org.shipplan.transport.core.InvariantViolationException;
import org.shipplan.transport.core.NonConvergenceException;
import org.shipplan.transport.core.SolverConfig;
import org.shipplan.transport.model.Allocation;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.OpportunityCostTable;
import org.shipplan.transport.model.Potentials;
import org.shipplan.transport.model.TransportationProblem;
import org.shipplan.transport.trace.InitialRecord;
import org.shipplan.transport.trace.IterationRecord;
import org.shipplan.transport.trace.SolveStatus;
import org.shipplan.transport.trace.SolveTrace;
import org.shipplan.transport.trace.StepListener;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MODI optimization loop, run as an explicit state machine.
 *
 * <ul>
 * <li>{@code EVALUATING}: solve potentials, price non-basic cells, pick the entering cell.
 * No negative reduced cost means {@code OPTIMAL}; a spent budget means {@code FAILED}.</li>
 * <li>{@code SHIFTING}: find the loop, shift theta around it, swap entering and leaving cells
 * in the basis, record the pivot.</li>
 * </ul>
 *
 * <p>Loop discovery happens before any mutation, so a pivot either commits fully or the
 * solve fails with the allocation as it was after the previous pivot.</p>
 */
@Slf4j
public final class Reoptimizer {

    enum State {
        EVALUATING,
        SHIFTING,
        OPTIMAL,
        FAILED
    }

    private final PotentialSolver potentialSolver;
    private final OpportunityCostEvaluator evaluator;
    private final LoopFinder loopFinder;

    public Reoptimizer() {
        this(new PotentialSolver(), new OpportunityCostEvaluator(), new LoopFinder());
    }

    Reoptimizer(PotentialSolver potentialSolver, OpportunityCostEvaluator evaluator, LoopFinder loopFinder) {
        this.potentialSolver = Objects.requireNonNull(potentialSolver, "potentialSolver");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.loopFinder = Objects.requireNonNull(loopFinder, "loopFinder");
    }

    /**
     * Drives {@code allocation} and {@code basis} to optimality in place.
     *
     * @param problem validated problem.
     * @param allocation initial allocation; mutated.
     * @param basis initial basis of size {@code m + n - 1}; mutated.
     * @param initial record of the starting point, first entry of the trace.
     * @param config tolerances, tie-break policies and iteration multiplier.
     * @param listener receives each committed pivot and the finish event.
     * @return final potentials, reduced costs and trace.
     * @throws NonConvergenceException when the iteration cap is reached first.
     * @throws InvariantViolationException when the basis stops being a spanning tree.
     */
    public ReoptimizationResult run(
            TransportationProblem problem,
            Allocation allocation,
            BasicCellSet basis,
            InitialRecord initial,
            SolverConfig config,
            StepListener listener
    ) {
        double tolerance = config.getZeroTolerance();
        IterationBudget budget = IterationBudget.of(config.iterationCap(problem.rows(), problem.columns()));
        List<IterationRecord> records = new ArrayList<>();

        State state = State.EVALUATING;
        Potentials potentials = null;
        OpportunityCostTable table = null;
        Cell entering = null;

        while (true) {
            switch (state) {
                case EVALUATING -> {
                    potentials = potentialSolver.solve(problem, basis, tolerance);
                    table = evaluator.evaluate(problem, basis, potentials);
                    entering = evaluator.selectEntering(table, tolerance, config.getEnteringTieBreak());
                    if (entering == null) {
                        state = State.OPTIMAL;
                    } else if (!budget.allowsAnother(records.size())) {
                        state = State.FAILED;
                    } else {
                        state = State.SHIFTING;
                    }
                }
                case SHIFTING -> {
                    IterationRecord record = pivot(
                            problem,
                            allocation,
                            basis,
                            potentials,
                            entering,
                            table.get(entering.row(), entering.column()),
                            records.size() + 1,
                            config
                    );
                    records.add(record);
                    listener.onIteration(record);
                    state = State.EVALUATING;
                }
                case OPTIMAL -> {
                    SolveTrace trace = new SolveTrace(initial, records, SolveStatus.OPTIMAL);
                    listener.onFinish(trace);
                    return new ReoptimizationResult(potentials, table, trace);
                }
                case FAILED -> {
                    SolveTrace trace = new SolveTrace(initial, records, SolveStatus.NON_CONVERGED);
                    double bestCost = allocation.totalCost(problem);
                    log.warn("MODI hit the iteration cap of {} on a {}x{} instance; best cost {}",
                            budget.maxIterations(), problem.rows(), problem.columns(), bestCost);
                    listener.onFinish(trace);
                    throw new NonConvergenceException(records.size(), allocation.snapshot(), bestCost, trace);
                }
            }
        }
    }

    /**
     * Runs one SHIFTING step and returns its record.
     */
    private IterationRecord pivot(
            TransportationProblem problem,
            Allocation allocation,
            BasicCellSet basis,
            Potentials potentials,
            Cell entering,
            double enteringOpportunityCost,
            int iteration,
            SolverConfig config
    ) {
        double tolerance = config.getZeroTolerance();
        SteppingStoneLoop loop = loopFinder.find(basis, entering);

        List<Cell> minusCells = loop.minusCells();
        double theta = Double.POSITIVE_INFINITY;
        for (Cell cell : minusCells) {
            theta = Math.min(theta, allocation.get(cell));
        }
        theta = Math.max(0.0d, theta);

        Cell leaving = null;
        for (Cell cell : minusCells) {
            if (allocation.get(cell) - theta <= tolerance
                    && (leaving == null || config.getLeavingTieBreak().prefers(cell, leaving))) {
                leaving = cell;
            }
        }
        if (leaving == null) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_NO_LEAVING_CELL,
                    "loop for " + entering + " has no leaving candidate at theta " + theta
            );
        }

        for (int i = 0; i < loop.length(); i++) {
            Cell cell = loop.cell(i);
            if (loop.sign(i) == SteppingStoneLoop.Sign.PLUS) {
                allocation.add(cell, theta);
            } else {
                allocation.add(cell, -theta);
                if (allocation.get(cell) <= tolerance) {
                    allocation.set(cell, 0.0d);
                }
            }
        }

        basis.add(entering);
        basis.remove(leaving);
        if (!basis.hasTreeSize()) {
            throw new InvariantViolationException(
                    InvariantViolationException.REASON_BASIS_SIZE,
                    "pivot " + iteration + " left " + basis.size() + " basic cells, expected " + problem.basisSize()
            );
        }

        double totalCost = allocation.totalCost(problem);
        log.debug("pivot {}: {} enters (d={}), {} leaves, theta={}, cost={}",
                iteration, entering, enteringOpportunityCost, leaving, theta, totalCost);

        return IterationRecord.builder()
                .iteration(iteration)
                .entering(entering)
                .enteringOpportunityCost(enteringOpportunityCost)
                .potentials(potentials)
                .loop(loop.steps())
                .shiftQuantity(theta)
                .leaving(leaving)
                .totalCost(totalCost)
                .build();
    }
}
