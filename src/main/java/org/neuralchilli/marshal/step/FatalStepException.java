package org.neuralchilli.marshal.step;

import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.service.OrchestrationException;

/**
 * Thrown by a step handler when retrying cannot help (bad input, schema violation).
 */
public class FatalStepException extends OrchestrationException {

    public FatalStepException(String message) {
        super(ErrorCategory.FATAL, message);
    }

    public FatalStepException(String message, Throwable cause) {
        super(ErrorCategory.FATAL, message, cause);
    }
}
