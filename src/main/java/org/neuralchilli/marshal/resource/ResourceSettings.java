package org.neuralchilli.marshal.resource;

import java.time.Duration;

/**
 * Tunables of the resource monitor.
 *
 * @param capacityTokens     tokens the system can have granted at once; load is in-flight grants over this
 * @param alertThreshold     share of a grant above which consumption is logged as a warning
 * @param throttleRatio      consumption over {@code throttleRatio * granted} throttles the step
 * @param behaviorWindow     trailing window for success and compliance rates
 * @param latencyTarget      step latency considered fully healthy
 * @param maxTokensPerStep   global per-step cap, null for none
 */
public record ResourceSettings(
        long capacityTokens,
        double alertThreshold,
        double throttleRatio,
        Duration behaviorWindow,
        Duration latencyTarget,
        Long maxTokensPerStep
) {

    public ResourceSettings {
        if (capacityTokens <= 0) {
            throw new IllegalArgumentException("capacityTokens must be positive");
        }
        if (alertThreshold <= 0 || alertThreshold > 1) {
            throw new IllegalArgumentException("alertThreshold must be in (0, 1]");
        }
        if (throttleRatio < 1) {
            throw new IllegalArgumentException("throttleRatio must be >= 1");
        }
        if (behaviorWindow == null) {
            behaviorWindow = Duration.ofDays(30);
        }
        if (latencyTarget == null || latencyTarget.isZero()) {
            latencyTarget = Duration.ofSeconds(30);
        }
    }

    public static ResourceSettings defaults() {
        return new ResourceSettings(100_000, 0.8, 1.5, Duration.ofDays(30), Duration.ofSeconds(30), null);
    }
}
