package org.neuralchilli.marshal.domain;

/**
 * Lifecycle status of a run.
 */
public enum RunStatus {
    /**
     * Created, no step dispatched yet
     */
    INITIATED,

    /**
     * Scheduler is walking the DAG
     */
    RUNNING,

    /**
     * Every step completed, or only optional branches were lost (degraded)
     */
    COMPLETED,

    /**
     * A required step failed
     */
    FAILED,

    /**
     * Sandbox run re-executing a prior run
     */
    REPLAYING,

    /**
     * Cancelled by the caller
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
