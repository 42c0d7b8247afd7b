package org.neuralchilli.marshal.service;

import org.neuralchilli.marshal.domain.ErrorCategory;

/**
 * Persisted data failed an integrity or compatibility check, for example a
 * tampered ledger or a replay across engine versions.
 */
public class ValidationException extends OrchestrationException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }
}
