package org.neuralchilli.marshal.domain;

/**
 * Kinds of ledger entries.
 */
public enum EventType {
    RUN_START,
    STEP_START,
    STEP_RETRY,
    STEP_SUCCESS,
    STEP_FAILURE,
    STEP_SKIPPED,
    STEP_CANCELLED,
    CIRCUIT_OPEN,
    CIRCUIT_CLOSE,
    BUDGET_DENIED,
    BUDGET_THROTTLED,
    CORRECTION,
    RUN_COMPLETE;

    /**
     * Whether this event ends a step's own event sequence
     */
    public boolean isStepTerminal() {
        return this == STEP_SUCCESS || this == STEP_FAILURE
                || this == STEP_SKIPPED || this == STEP_CANCELLED;
    }
}
