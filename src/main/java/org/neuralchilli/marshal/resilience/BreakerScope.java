package org.neuralchilli.marshal.resilience;

/**
 * How widely a step's circuit breaker is shared.
 */
public enum BreakerScope {
    /**
     * One breaker per (template, step), shared by all runs of the template
     */
    TEMPLATE,

    /**
     * One breaker per (run, step)
     */
    RUN
}
