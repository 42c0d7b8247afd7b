package org.neuralchilli.marshal.worker;

import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;

/**
 * Terminal outcome of one step execution.
 *
 * @param cached the step was already COMPLETED under its idempotency key and was not invoked
 */
public record StepResult(StepState state, boolean cached) {

    public static StepResult executed(StepState state) {
        return new StepResult(state, false);
    }

    public static StepResult fromCache(StepState state) {
        return new StepResult(state, true);
    }

    public String stepName() {
        return state.stepName();
    }

    public StepStatus status() {
        return state.status();
    }

    public boolean succeeded() {
        return state.isCompleted();
    }
}
