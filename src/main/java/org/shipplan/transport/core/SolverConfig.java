package org.shipplan.transport.core;

import lombok.Builder;
import lombok.Value;
import org.shipplan.transport.modi.TieBreakPolicy;

import java.util.Locale;

/**
 * Solver tuning knobs: iteration cap, numeric tolerances, tie-break policies.
 */
@Value
@Builder(toBuilder = true)
public class SolverConfig {
    public static final int DEFAULT_ITERATION_MULTIPLIER = 10;
    public static final double DEFAULT_BALANCE_TOLERANCE = 1e-9d;
    public static final double DEFAULT_ZERO_TOLERANCE = 1e-9d;

    static final String PROP_MAX_ITERATIONS = "shipplan.solver.maxIterations";
    static final String PROP_ITERATION_MULTIPLIER = "shipplan.solver.iterationMultiplier";
    static final String PROP_BALANCE_TOLERANCE = "shipplan.solver.balanceTolerance";
    static final String PROP_ZERO_TOLERANCE = "shipplan.solver.zeroTolerance";
    static final String PROP_ENTERING_TIE_BREAK = "shipplan.solver.enteringTieBreak";
    static final String PROP_LEAVING_TIE_BREAK = "shipplan.solver.leavingTieBreak";

    /**
     * Iteration cap is {@code iterationMultiplier * m * n}. Values {@code <= 0} use the default.
     */
    @Builder.Default
    int iterationMultiplier = DEFAULT_ITERATION_MULTIPLIER;

    /**
     * Explicit iteration cap. Values {@code <= 0} derive the cap from {@link #iterationMultiplier}.
     */
    @Builder.Default
    int maxIterations = 0;

    /**
     * Relative tolerance for the supply/demand balance check.
     */
    @Builder.Default
    double balanceTolerance = DEFAULT_BALANCE_TOLERANCE;

    /**
     * Absolute tolerance below which quantities and reduced costs count as zero.
     */
    @Builder.Default
    double zeroTolerance = DEFAULT_ZERO_TOLERANCE;

    /**
     * Choice among equally negative entering cells.
     */
    @Builder.Default
    TieBreakPolicy enteringTieBreak = TieBreakPolicy.LOWEST_INDEX;

    /**
     * Choice among loop cells that reach zero together.
     */
    @Builder.Default
    TieBreakPolicy leavingTieBreak = TieBreakPolicy.LOWEST_INDEX;

    /**
     * Loads configuration from JVM system properties, falling back per field to defaults.
     */
    public static SolverConfig defaults() {
        return SolverConfig.builder()
                .maxIterations(readInt(PROP_MAX_ITERATIONS, 0))
                .iterationMultiplier(readInt(PROP_ITERATION_MULTIPLIER, DEFAULT_ITERATION_MULTIPLIER))
                .balanceTolerance(readTolerance(PROP_BALANCE_TOLERANCE, DEFAULT_BALANCE_TOLERANCE))
                .zeroTolerance(readTolerance(PROP_ZERO_TOLERANCE, DEFAULT_ZERO_TOLERANCE))
                .enteringTieBreak(readPolicy(PROP_ENTERING_TIE_BREAK))
                .leavingTieBreak(readPolicy(PROP_LEAVING_TIE_BREAK))
                .build();
    }

    /**
     * Effective iteration cap for an m x n instance.
     */
    public int iterationCap(int rows, int columns) {
        if (maxIterations > 0) {
            return maxIterations;
        }
        int multiplier = iterationMultiplier > 0 ? iterationMultiplier : DEFAULT_ITERATION_MULTIPLIER;
        long cap = (long) multiplier * rows * columns;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, cap));
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readTolerance(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) && value >= 0.0d ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static TieBreakPolicy readPolicy(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return TieBreakPolicy.LOWEST_INDEX;
        }
        try {
            return TieBreakPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return TieBreakPolicy.LOWEST_INDEX;
        }
    }
}
