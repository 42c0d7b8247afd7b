package org.neuralchilli.marshal.domain;

/**
 * Lifecycle status of a step within a run.
 */
public enum StepStatus {
    /**
     * Waiting for dependencies, or reset for another attempt cycle
     */
    PENDING,

    /**
     * Executor is running an attempt
     */
    RUNNING,

    /**
     * Finished successfully; the state is immutable from here on
     */
    COMPLETED,

    /**
     * Retries, circuit breaker or budget exhausted
     */
    FAILED,

    /**
     * Never dispatched because an upstream step did not complete
     */
    SKIPPED,

    /**
     * Run was cancelled before the step finished
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Whether a resumed run should give the step another attempt cycle.
     */
    public boolean isResumable() {
        return this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}
