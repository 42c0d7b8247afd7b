package org.neuralchilli.marshal.state;

import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.domain.StepStatus;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshot of a run recovered from the state store.
 *
 * @param resetSteps steps whose abandoned RUNNING state was put back to PENDING
 */
public record RunState(
        Run run,
        Map<String, StepState> steps,
        Set<String> resetSteps
) {

    public RunState {
        steps = Map.copyOf(steps);
        resetSteps = Set.copyOf(resetSteps);
    }

    public Set<String> stepsIn(StepStatus status) {
        return steps.values().stream()
                .filter(s -> s.status() == status)
                .map(StepState::stepName)
                .collect(Collectors.toSet());
    }
}
