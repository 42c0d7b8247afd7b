package org.neuralchilli.marshal.resilience;

public enum CircuitState {
    /**
     * Calls pass; consecutive failures are counted
     */
    CLOSED,

    /**
     * Calls are rejected until the recovery timeout elapses
     */
    OPEN,

    /**
     * One trial call is let through to test recovery
     */
    HALF_OPEN
}
