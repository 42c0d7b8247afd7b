package org.neuralchilli.marshal.service;

import org.neuralchilli.marshal.domain.ErrorCategory;

public class RunNotFoundException extends OrchestrationException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super(ErrorCategory.VALIDATION, "Run not found: " + runId);
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
