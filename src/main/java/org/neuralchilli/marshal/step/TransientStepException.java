package org.neuralchilli.marshal.step;

import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.service.OrchestrationException;

/**
 * Thrown by a step handler for failures worth another attempt
 * (rate limits, connection resets, upstream 5xx).
 */
public class TransientStepException extends OrchestrationException {

    public TransientStepException(String message) {
        super(ErrorCategory.TRANSIENT, message);
    }

    public TransientStepException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, message, cause);
    }
}
