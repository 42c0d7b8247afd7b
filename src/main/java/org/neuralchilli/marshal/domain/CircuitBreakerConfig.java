package org.neuralchilli.marshal.domain;

import java.io.Serializable;
import java.time.Duration;

/**
 * Circuit breaker thresholds for a step.
 */
public record CircuitBreakerConfig(
        int failureThreshold,
        Duration recoveryTimeout
) implements Serializable {

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be non-negative");
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, Duration.ofSeconds(60));
    }
}
