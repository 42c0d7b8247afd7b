package org.neuralchilli.marshal.resource;

import java.util.Map;

/**
 * Point-in-time view of the monitor's accounting.
 */
public record ResourceSnapshot(
        long inFlightTokens,
        long capacityTokens,
        long totalGranted,
        long totalConsumed,
        long denials,
        long throttles,
        double currentLoad,
        double healthMultiplier,
        Map<String, StepAccount> steps
) {
}
