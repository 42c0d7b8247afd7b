package org.neuralchilli.marshal.service;

import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A run together with its step states, in pipeline order.
 */
public record RunReport(Run run, List<StepState> steps) {

    public RunReport {
        steps = List.copyOf(steps);
    }

    public Optional<StepState> step(String stepName) {
        return steps.stream()
                .filter(s -> s.stepName().equals(stepName))
                .findFirst();
    }

    public List<StepState> stepsIn(StepStatus status) {
        return steps.stream()
                .filter(s -> s.status() == status)
                .toList();
    }

    /**
     * Process exit code for a finished run: 0 on success (degraded included),
     * 6 when cancelled, otherwise the code of the first failed step's category.
     *
     * @throws IllegalStateException if the run has not finished
     */
    public int exitCode() {
        return switch (run.status()) {
            case COMPLETED -> 0;
            case CANCELLED -> ErrorCategory.CANCELLED.exitCode();
            case FAILED -> stepsIn(StepStatus.FAILED).stream()
                    .map(StepState::errorCategory)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(ErrorCategory.FATAL)
                    .exitCode();
            default -> throw new IllegalStateException("Run " + run.runId() + " has not finished: " + run.status());
        };
    }
}
