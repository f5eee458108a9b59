package org.shipplan.transport.initial;

import org.shipplan.transport.model.Allocation;
import org.shipplan.transport.model.BasicCellSet;

/**
 * Output of an {@link InitialAllocator}.
 *
 * @param allocation mutable allocation handed over to the reoptimizer.
 * @param basis basic cells, {@code m + n - 1} of them.
 * @param phantomCells number of zero-valued cells inserted to repair degeneracy.
 */
public record InitialBasis(Allocation allocation, BasicCellSet basis, int phantomCells) {
}
