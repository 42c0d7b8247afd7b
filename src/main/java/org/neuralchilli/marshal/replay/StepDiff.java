package org.neuralchilli.marshal.replay;

import java.util.List;

/**
 * Output comparison of one re-executed step.
 */
public record StepDiff(
        String stepName,
        String originalHash,
        String replayHash,
        boolean matched,
        List<FieldDifference> differences
) {

    public StepDiff {
        differences = differences != null ? List.copyOf(differences) : List.of();
    }
}
