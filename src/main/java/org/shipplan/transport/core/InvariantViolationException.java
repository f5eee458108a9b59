package org.shipplan.transport.core;

/**
 * Internal algorithmic invariant failure.
 *
 * <p>Always fatal. Seeing one means degeneracy handling or basis bookkeeping is broken,
 * never that the caller's input was unusual.</p>
 */
public final class InvariantViolationException extends TransportationException {
    public static final String REASON_NWCM_FINAL_CELL = "TPP_INVARIANT_NWCM_FINAL_CELL";
    public static final String REASON_NWCM_EXHAUSTED = "TPP_INVARIANT_NWCM_EXHAUSTED";
    public static final String REASON_BASIS_SIZE = "TPP_INVARIANT_BASIS_SIZE";
    public static final String REASON_DISCONNECTED_BASIS = "TPP_INVARIANT_DISCONNECTED_BASIS";
    public static final String REASON_POTENTIAL_CONFLICT = "TPP_INVARIANT_POTENTIAL_CONFLICT";
    public static final String REASON_LOOP_NOT_FOUND = "TPP_INVARIANT_LOOP_NOT_FOUND";
    public static final String REASON_NO_LEAVING_CELL = "TPP_INVARIANT_NO_LEAVING_CELL";
    public static final String REASON_ENTERING_CELL_BASIC = "TPP_INVARIANT_ENTERING_CELL_BASIC";

    public InvariantViolationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
