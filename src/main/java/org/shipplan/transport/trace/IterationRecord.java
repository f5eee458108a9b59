package org.shipplan.transport.trace;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.shipplan.transport.model.Cell;
import org.shipplan.transport.model.Potentials;
import org.shipplan.transport.modi.SteppingStoneLoop;

import java.util.List;

/**
 * One committed MODI pivot.
 */
@Value
@Builder
public class IterationRecord {
    /** 1-based pivot index. */
    int iteration;
    /** Cell that entered the basis. */
    Cell entering;
    /** Reduced cost of the entering cell before the pivot (negative). */
    double enteringOpportunityCost;
    /** Potentials that priced the entering cell. */
    Potentials potentials;
    /** Loop cells with signs, starting at the entering cell. */
    @Singular("loopStep")
    List<SteppingStoneLoop.Step> loop;
    /** Quantity shifted around the loop (theta). */
    double shiftQuantity;
    /** Cell that left the basis. */
    Cell leaving;
    /** Total cost after the pivot. */
    double totalCost;
}
