package org.shipplan.transport.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Client-facing balanced transportation instance.
 *
 * <p>Rows are warehouses, columns are destinations. Labels are optional; when omitted the
 * solver numbers sites as {@code Warehouse 1..m} and {@code Dest 1..n}.</p>
 */
@Value
@Builder
public class TransportationRequest {
    /** Unit shipping cost, {@code costs[warehouse][destination]}. */
    double[][] costs;
    /** Available quantity per warehouse. */
    double[] supply;
    /** Required quantity per destination. */
    double[] demand;
    /** Optional warehouse labels, one per row. */
    @Singular
    List<String> warehouseLabels;
    /** Optional destination labels, one per column. */
    @Singular
    List<String> destinationLabels;
}
