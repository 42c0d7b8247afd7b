package org.neuralchilli.marshal.resilience;

import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.service.OrchestrationException;

import java.time.Duration;

/**
 * The circuit for a step is open and the call was rejected without an attempt.
 */
public class CircuitOpenException extends OrchestrationException {

    private final Duration retryAfter;

    public CircuitOpenException(String circuit, Duration retryAfter) {
        super(ErrorCategory.CIRCUIT_OPEN,
                "Circuit '" + circuit + "' is open, retry after " + retryAfter.toMillis() + "ms");
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
