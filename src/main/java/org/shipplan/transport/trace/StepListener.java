package org.shipplan.transport.trace;

/**
 * Receives solver progress as it is committed.
 *
 * <p>Callbacks run on the solving thread, in order: one {@link #onInitial}, zero or more
 * {@link #onIteration}, then {@link #onFinish} unless the solve fails with an invariant
 * violation.</p>
 */
public interface StepListener {

    /** Listener that ignores every event. */
    StepListener NOOP = new StepListener() {
    };

    default void onInitial(InitialRecord record) {
    }

    default void onIteration(IterationRecord record) {
    }

    default void onFinish(SolveTrace trace) {
    }
}
