package org.neuralchilli.marshal.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * Retry-with-backoff settings for a step.
 *
 * <p>The nominal delay before attempt {@code n+1} is
 * {@code min(baseDelay * 2^(n-1), maxDelay)}; a symmetric jitter of
 * {@code ±jitterFactor * delay} is applied on top and the result is floored at
 * {@link #MIN_DELAY}.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double jitterFactor,
        boolean retryOnTimeout
) implements Serializable {

    public static final Duration MIN_DELAY = Duration.ofMillis(100);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1), got: " + jitterFactor);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.1, true);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0, false);
    }

    /**
     * Delay before the attempt following {@code failedAttempt}, without jitter.
     */
    public Duration nominalDelay(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1");
        }
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        int shift = Math.min(failedAttempt - 1, 30);
        // compare before shifting: base << shift may wrap
        if (base > (max >> shift)) {
            return maxDelay;
        }
        return Duration.ofMillis(base << shift);
    }

    /**
     * Delay before the attempt following {@code failedAttempt}, jittered with {@code random}.
     */
    public Duration delayFor(int failedAttempt, RandomGenerator random) {
        long nominal = nominalDelay(failedAttempt).toMillis();
        double jitter = jitterFactor == 0.0 ? 0.0 : random.nextDouble(-jitterFactor, jitterFactor);
        long jittered = Math.round(nominal * (1.0 + jitter));
        return Duration.ofMillis(Math.max(jittered, MIN_DELAY.toMillis()));
    }

    /**
     * Upper bound of any delay this policy can produce.
     */
    public Duration maxJitteredDelay() {
        long bound = Math.round(maxDelay.toMillis() * (1.0 + jitterFactor));
        return Duration.ofMillis(Math.max(bound, MIN_DELAY.toMillis()));
    }
}
