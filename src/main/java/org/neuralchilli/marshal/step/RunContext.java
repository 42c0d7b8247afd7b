package org.neuralchilli.marshal.step;

import java.util.Map;
import java.util.Random;
import java.util.function.BooleanSupplier;

/**
 * What a handler knows about the run invoking it.
 *
 * @param runId            identity of the logical run; a replay sees the id of the run it replays
 * @param executionRunId   id of the run actually executing (differs from {@code runId} in a replay)
 * @param spanId           span of this step invocation
 * @param seed             run seed, null when the run is not seeded
 * @param upstreamOutputs  outputs of the step's direct dependencies, by step name
 * @param grantedTokens    token grant from admission
 */
public record RunContext(
        String runId,
        String executionRunId,
        String stepName,
        String spanId,
        Long seed,
        Map<String, Map<String, Object>> upstreamOutputs,
        long grantedTokens,
        BooleanSupplier cancellation
) {

    public RunContext {
        if (upstreamOutputs == null) {
            upstreamOutputs = Map.of();
        }
        if (cancellation == null) {
            cancellation = () -> false;
        }
    }

    /**
     * Advisory: the run was cancelled. Long-running handlers should stop early.
     */
    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }

    public boolean isReplay() {
        return !runId.equals(executionRunId);
    }

    public Map<String, Object> upstream(String stepName) {
        return upstreamOutputs.getOrDefault(stepName, Map.of());
    }

    /**
     * Random source for this step. Seeded runs get the same sequence on every
     * execution of the step, including replays.
     */
    public Random random() {
        if (seed == null) {
            return new Random();
        }
        return new Random(seed * 31 + stepName.hashCode());
    }
}
