package org.shipplan.transport.modi;

import org.shipplan.transport.model.OpportunityCostTable;
import org.shipplan.transport.model.Potentials;
import org.shipplan.transport.trace.SolveTrace;

/**
 * Outcome of a converged MODI run. The allocation itself was updated in place.
 *
 * @param potentials potentials of the final basis.
 * @param opportunityCosts reduced costs of the final basis, all {@code >= -tolerance}.
 * @param trace initial record plus every pivot.
 */
public record ReoptimizationResult(Potentials potentials, OpportunityCostTable opportunityCosts, SolveTrace trace) {

    public int iterations() {
        return trace.iterations().size();
    }
}
