package org.neuralchilli.marshal.service;

import org.neuralchilli.marshal.domain.ErrorCategory;

/**
 * Base of every error the orchestrator raises. Unchecked; the category decides
 * whether a step attempt is retried and which exit code a caller reports.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorCategory category;

    public OrchestrationException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public OrchestrationException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public int exitCode() {
        return category.exitCode();
    }
}
