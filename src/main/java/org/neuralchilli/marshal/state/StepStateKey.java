package org.neuralchilli.marshal.state;

import javax.annotation.Nonnull;
import java.io.Serializable;

/**
 * Locates a step state: the run it belongs to and the step name.
 * Value type of the idempotency index.
 */
public record StepStateKey(String runId, String stepName) implements Serializable {

    public StepStateKey {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run ID cannot be null or empty");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be null or empty");
        }
    }

    @Nonnull
    @Override
    public String toString() {
        return runId + "/" + stepName;
    }
}
