package org.shipplan.transport.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.shipplan.transport.initial.InitialAllocator;
import org.shipplan.transport.initial.InitialBasis;
import org.shipplan.transport.initial.NorthWestCornerAllocator;
import org.shipplan.transport.model.Allocation;
import org.shipplan.transport.model.BasicCellSet;
import org.shipplan.transport.model.TransportationProblem;
import org.shipplan.transport.modi.ReoptimizationResult;
import org.shipplan.transport.modi.Reoptimizer;
import org.shipplan.transport.trace.InitialRecord;
import org.shipplan.transport.trace.ShipmentLine;
import org.shipplan.transport.trace.StepListener;
import org.shipplan.transport.validation.ProblemValidator;

/**
 * Solver entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate shape, value domain, labels and balance; fail before any allocation.</li>
 * <li>Build the initial basis (north-west corner unless overridden).</li>
 * <li>Run MODI to optimality under the configured iteration cap.</li>
 * <li>Assemble allocation, cost, shipment summary and the full trace.</li>
 * </ul>
 *
 * <p>The solver holds no per-solve state; concurrent calls on one instance share nothing
 * but the configured listener.</p>
 */
@Slf4j
public final class TransportationSolver {
    private final SolverConfig config;
    private final InitialAllocator initialAllocator;
    private final Reoptimizer reoptimizer;
    private final StepListener listener;

    /**
     * Creates a solver.
     *
     * @param config solver configuration; {@code null} reads {@link SolverConfig#defaults()}.
     * @param initialAllocator optional initial-basis override.
     * @param listener optional step listener.
     */
    @Builder
    public TransportationSolver(SolverConfig config, InitialAllocator initialAllocator, StepListener listener) {
        this.config = config == null ? SolverConfig.defaults() : config;
        this.initialAllocator = initialAllocator == null ? new NorthWestCornerAllocator() : initialAllocator;
        this.reoptimizer = new Reoptimizer();
        this.listener = listener == null ? StepListener.NOOP : listener;
    }

    /**
     * Solves with default configuration and no listener.
     */
    public TransportationSolver() {
        this(null, null, null);
    }

    /**
     * Solves an unlabeled instance.
     *
     * @see #solve(TransportationRequest)
     */
    public TransportationPlan solve(double[][] costs, double[] supply, double[] demand) {
        return solve(TransportationRequest.builder().costs(costs).supply(supply).demand(demand).build());
    }

    /**
     * Computes the cost-minimal shipment plan.
     *
     * @param request balanced instance.
     * @return optimal plan with its trace.
     * @throws ShapeException on missing input, dimension mismatch or invalid values.
     * @throws BalanceException when total supply differs from total demand.
     * @throws InvariantViolationException on an internal basis defect.
     * @throws NonConvergenceException when the iteration cap is reached before optimality.
     */
    public TransportationPlan solve(TransportationRequest request) {
        if (request == null) {
            throw new ShapeException(ShapeException.REASON_NULL_INPUT, "request is required");
        }
        TransportationProblem problem = ProblemValidator.validate(
                request.getCosts(),
                request.getSupply(),
                request.getDemand(),
                request.getWarehouseLabels(),
                request.getDestinationLabels(),
                config.getBalanceTolerance()
        );
        log.debug("solving {}x{} instance, total supply {}, total demand {}",
                problem.rows(), problem.columns(), problem.totalSupply(), problem.totalDemand());

        InitialBasis start = initialAllocator.allocate(problem, quantityTolerance(problem));
        Allocation allocation = start.allocation();
        BasicCellSet basis = start.basis();
        InitialRecord initial = InitialRecord.builder()
                .allocation(allocation.snapshot())
                .basicCells(basis.cells())
                .phantomCells(start.phantomCells())
                .totalCost(allocation.totalCost(problem))
                .build();
        listener.onInitial(initial);

        ReoptimizationResult result = reoptimizer.run(problem, allocation, basis, initial, config, listener);

        double[][] finalAllocation = allocation.snapshot();
        double totalCost = allocation.totalCost(problem);
        log.info("solved {}x{} instance in {} iteration(s): cost {} -> {}",
                problem.rows(), problem.columns(), result.iterations(), initial.getTotalCost(), totalCost);

        return TransportationPlan.builder()
                .problem(problem)
                .allocation(finalAllocation)
                .totalCost(totalCost)
                .initialCost(initial.getTotalCost())
                .iterations(result.iterations())
                .basicCells(basis.cells())
                .potentials(result.potentials())
                .opportunityCosts(result.opportunityCosts())
                .shipments(ShipmentLine.linesOf(problem, finalAllocation, config.getZeroTolerance()))
                .trace(result.trace())
                .build();
    }

    /**
     * Exhaustion tolerance for the initial allocator, scaled to the instance size so a
     * balance accepted within relative tolerance never trips the final-cell check.
     */
    private double quantityTolerance(TransportationProblem problem) {
        double scale = Math.max(1.0d, Math.max(problem.totalSupply(), problem.totalDemand()));
        return Math.max(config.getZeroTolerance(), config.getBalanceTolerance() * scale);
    }
}
