package org.neuralchilli.marshal.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Mutable execution record of one (run, step) pair, modelled as an immutable value
 * whose transitions return new copies. A COMPLETED state rejects every transition.
 */
public record StepState(
        String runId,
        String stepName,
        String idempotencyKey,
        StepStatus status,
        int attemptCount,
        Instant startTime,
        Instant endTime,
        String lastError,
        ErrorCategory errorCategory,
        long grantedTokens,
        long consumedTokens,
        boolean throttled,
        Map<String, Object> outputRefs,
        String outputHash,
        Instant updatedAt
) implements Serializable {

    public StepState {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run ID cannot be null or empty");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be null or empty");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("Attempt count must be >= 0");
        }

        // Defaults
        if (outputRefs == null) {
            outputRefs = Map.of();
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    /**
     * Create the state the scheduler records when it first admits a step
     */
    public static StepState pending(String runId, String stepName, String idempotencyKey) {
        return new StepState(runId, stepName, idempotencyKey, StepStatus.PENDING, 0,
                null, null, null, null, 0, 0, false, Map.of(), null, Instant.now());
    }

    /**
     * Record the token grant from an admission decision
     */
    public StepState admit(long granted) {
        ensureMutable();
        return new StepState(runId, stepName, idempotencyKey, status, attemptCount,
                startTime, endTime, lastError, errorCategory, granted, consumedTokens,
                throttled, outputRefs, outputHash, Instant.now());
    }

    /**
     * Begin a new attempt
     */
    public StepState startAttempt() {
        ensureMutable();
        Instant now = Instant.now();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.RUNNING, attemptCount + 1,
                startTime != null ? startTime : now, null, lastError, errorCategory,
                grantedTokens, consumedTokens, throttled, outputRefs, outputHash, now);
    }

    /**
     * Record an attempt failure that will be retried
     */
    public StepState attemptFailed(String error, ErrorCategory category) {
        ensureMutable();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.RUNNING, attemptCount,
                startTime, null, error, category, grantedTokens, consumedTokens,
                throttled, outputRefs, outputHash, Instant.now());
    }

    /**
     * Flag for manual review after over-consumption. The reduced allocation is
     * applied by the resource monitor on the step's next admission.
     */
    public StepState throttle() {
        ensureMutable();
        return new StepState(runId, stepName, idempotencyKey, status, attemptCount,
                startTime, endTime, lastError, errorCategory, grantedTokens, consumedTokens,
                true, outputRefs, outputHash, Instant.now());
    }

    public StepState complete(Map<String, Object> outputs, String hash, long consumed) {
        ensureMutable();
        Instant now = Instant.now();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.COMPLETED, attemptCount,
                startTime != null ? startTime : now, now, null, null, grantedTokens, consumed,
                throttled, outputs, hash, now);
    }

    public StepState fail(String error, ErrorCategory category) {
        ensureMutable();
        Instant now = Instant.now();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.FAILED, attemptCount,
                startTime, now, error, category, grantedTokens, consumedTokens,
                throttled, outputRefs, outputHash, now);
    }

    public StepState skip(String reason) {
        ensureMutable();
        Instant now = Instant.now();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.SKIPPED, attemptCount,
                startTime, now, reason, null, grantedTokens, consumedTokens,
                throttled, outputRefs, outputHash, now);
    }

    public StepState cancel() {
        ensureMutable();
        Instant now = Instant.now();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.CANCELLED, attemptCount,
                startTime, now, "Run cancelled", ErrorCategory.CANCELLED, grantedTokens, consumedTokens,
                throttled, outputRefs, outputHash, now);
    }

    /**
     * Put an abandoned or failed state back in the frontier. Attempt history is kept.
     */
    public StepState resetToPending() {
        ensureMutable();
        return new StepState(runId, stepName, idempotencyKey, StepStatus.PENDING, attemptCount,
                startTime, null, lastError, errorCategory, grantedTokens, consumedTokens,
                throttled, outputRefs, outputHash, Instant.now());
    }

    /**
     * The same state recorded under another run, used to seed replay sandboxes
     */
    public StepState copyFor(String otherRunId) {
        return new StepState(otherRunId, stepName, idempotencyKey, status, attemptCount,
                startTime, endTime, lastError, errorCategory, grantedTokens, consumedTokens,
                throttled, outputRefs, outputHash, updatedAt);
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    public boolean isCompleted() {
        return status == StepStatus.COMPLETED;
    }

    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    private void ensureMutable() {
        if (status == StepStatus.COMPLETED) {
            throw new IllegalStateException(
                    "Step state " + runId + "/" + stepName + " is COMPLETED and cannot change");
        }
    }
}
