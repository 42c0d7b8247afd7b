package org.neuralchilli.marshal.replay;

import org.neuralchilli.marshal.domain.RunStatus;

import java.util.List;
import java.util.Set;

/**
 * Outcome of a replay.
 *
 * @param replayedSteps steps that were re-executed; every other step reused the original output
 * @param matched       true when every re-executed step reproduced the original output hash
 */
public record ReplayResult(
        String replayRunId,
        String originalRunId,
        RunStatus status,
        Set<String> replayedSteps,
        List<StepDiff> diffs,
        boolean matched
) {

    public ReplayResult {
        replayedSteps = Set.copyOf(replayedSteps);
        diffs = List.copyOf(diffs);
    }

    public List<StepDiff> mismatches() {
        return diffs.stream()
                .filter(d -> !d.matched())
                .toList();
    }
}
