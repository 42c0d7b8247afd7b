package org.neuralchilli.marshal.resource;

import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.service.OrchestrationException;

/**
 * A step asked for more tokens than its dynamic ceiling allows.
 */
public class ResourceDeniedException extends OrchestrationException {

    private final long maximumAllowed;
    private final long suggestedBudget;

    public ResourceDeniedException(String stepName, long requested, long maximumAllowed, long suggestedBudget) {
        super(ErrorCategory.RESOURCE_DENIED, String.format(
                "Step '%s' requested %d tokens, maximum allowed is %d (suggested budget %d)",
                stepName, requested, maximumAllowed, suggestedBudget));
        this.maximumAllowed = maximumAllowed;
        this.suggestedBudget = suggestedBudget;
    }

    public long maximumAllowed() {
        return maximumAllowed;
    }

    public long suggestedBudget() {
        return suggestedBudget;
    }
}
