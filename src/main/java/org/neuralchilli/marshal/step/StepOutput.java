package org.neuralchilli.marshal.step;

import java.util.Map;

/**
 * What a step handler returns: references to its outputs (must be JSON
 * serializable) and the tokens it consumed.
 */
public record StepOutput(
        Map<String, Object> outputRefs,
        long consumedTokens
) {

    public StepOutput {
        if (outputRefs == null) {
            outputRefs = Map.of();
        }
        if (consumedTokens < 0) {
            throw new IllegalArgumentException("consumedTokens must be >= 0");
        }
    }

    public static StepOutput of(Map<String, Object> outputRefs, long consumedTokens) {
        return new StepOutput(outputRefs, consumedTokens);
    }
}
