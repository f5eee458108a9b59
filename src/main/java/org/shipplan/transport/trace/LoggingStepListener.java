package org.shipplan.transport.trace;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes the step log through SLF4J.
 */
@Slf4j
public final class LoggingStepListener implements StepListener {

    @Override
    public void onInitial(InitialRecord record) {
        log.info("Initial basic feasible solution (north-west corner) cost: {}", record.getTotalCost());
        if (record.getPhantomCells() > 0) {
            log.info("Degenerate start: {} zero-valued basic cell(s) added", record.getPhantomCells());
        }
    }

    @Override
    public void onIteration(IterationRecord record) {
        log.info(
                "Iteration {}: negative opportunity cost {} at {}; shifting {} units, {} leaves; cost now {}",
                record.getIteration(),
                record.getEnteringOpportunityCost(),
                record.getEntering(),
                record.getShiftQuantity(),
                record.getLeaving(),
                record.getTotalCost()
        );
    }

    @Override
    public void onFinish(SolveTrace trace) {
        if (trace.status() == SolveStatus.OPTIMAL) {
            log.info("All opportunity costs >= 0 after {} iteration(s); minimum total cost {}",
                    trace.iterations().size(), trace.finalCost());
        } else {
            log.warn("Stopped after {} iteration(s) without reaching optimality; best cost {}",
                    trace.iterations().size(), trace.finalCost());
        }
    }
}
