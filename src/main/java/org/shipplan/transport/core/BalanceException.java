package org.shipplan.transport.core;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when total supply and total demand differ beyond the configured tolerance.
 */
@Getter
@Accessors(fluent = true)
public final class BalanceException extends TransportationException {
    public static final String REASON_MISMATCH = "TPP_BALANCE_MISMATCH";

    private final double supplyTotal;
    private final double demandTotal;

    public BalanceException(double supplyTotal, double demandTotal) {
        super(
                REASON_MISMATCH,
                "total supply " + supplyTotal + " does not equal total demand " + demandTotal
                        + " (difference " + (supplyTotal - demandTotal) + ")"
        );
        this.supplyTotal = supplyTotal;
        this.demandTotal = demandTotal;
    }

    /**
     * Returns {@code supplyTotal - demandTotal}.
     */
    public double difference() {
        return supplyTotal - demandTotal;
    }
}
