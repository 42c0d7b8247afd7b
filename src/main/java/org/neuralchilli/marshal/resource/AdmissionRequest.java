package org.neuralchilli.marshal.resource;

import org.neuralchilli.marshal.domain.Priority;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepDefinition;

/**
 * What a step asks of the resource monitor before it may run.
 *
 * @param maxTokensPerStep run-level cap, null for none
 */
public record AdmissionRequest(
        String runId,
        String stepName,
        long requestedTokens,
        long baseBudget,
        Priority priority,
        Long maxTokensPerStep
) {

    public static AdmissionRequest of(Run run, StepDefinition step) {
        return new AdmissionRequest(run.runId(), step.name(), step.requestedTokens(),
                step.tokenBudgetBase(), step.priority(), run.maxTokensPerStep());
    }
}
