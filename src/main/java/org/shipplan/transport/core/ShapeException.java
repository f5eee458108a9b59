package org.shipplan.transport.core;

/**
 * Input contract failure: dimension mismatch, missing input, or an invalid value.
 *
 * <p>Raised before any allocation work begins.</p>
 */
public final class ShapeException extends TransportationException {
    public static final String REASON_NULL_INPUT = "TPP_SHAPE_NULL_INPUT";
    public static final String REASON_EMPTY = "TPP_SHAPE_EMPTY";
    public static final String REASON_RAGGED = "TPP_SHAPE_RAGGED";
    public static final String REASON_SUPPLY_LENGTH = "TPP_SHAPE_SUPPLY_LENGTH";
    public static final String REASON_DEMAND_LENGTH = "TPP_SHAPE_DEMAND_LENGTH";
    public static final String REASON_NEGATIVE_COST = "TPP_VALUE_NEGATIVE_COST";
    public static final String REASON_NEGATIVE_SUPPLY = "TPP_VALUE_NEGATIVE_SUPPLY";
    public static final String REASON_NEGATIVE_DEMAND = "TPP_VALUE_NEGATIVE_DEMAND";
    public static final String REASON_NON_FINITE = "TPP_VALUE_NON_FINITE";
    public static final String REASON_LABEL_INVALID = "TPP_LABEL_INVALID";

    public ShapeException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public ShapeException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
