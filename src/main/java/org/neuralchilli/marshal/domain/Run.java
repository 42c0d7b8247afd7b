package org.neuralchilli.marshal.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * One execution of a pipeline template. Owns its step states and ledger events
 * until retention cleanup removes it.
 */
public record Run(
        String runId,
        String templateName,
        Long seed,
        Map<String, Object> params,
        RunStatus status,
        Instant createdAt,
        Instant completedAt,
        boolean degraded,
        String replayOf,
        String engineVersion,
        boolean dryRun,
        Long maxTokensPerStep,
        String error
) implements Serializable {

    public Run {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run ID cannot be null or empty");
        }
        if (templateName == null || templateName.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created at cannot be null");
        }

        // Defaults
        if (params == null) {
            params = Map.of();
        }
    }

    /**
     * Create a new run in INITIATED status
     */
    public static Run create(
            String runId,
            String templateName,
            Long seed,
            Map<String, Object> params,
            String engineVersion,
            boolean dryRun,
            Long maxTokensPerStep
    ) {
        return new Run(runId, templateName, seed, params, RunStatus.INITIATED, Instant.now(),
                null, false, null, engineVersion, dryRun, maxTokensPerStep, null);
    }

    /**
     * Create the sandbox run that replays {@code original}
     */
    public static Run replayOf(Run original, String replayRunId, String engineVersion) {
        return new Run(replayRunId, original.templateName, original.seed, original.params,
                RunStatus.REPLAYING, Instant.now(), null, false, original.lineageRunId(), engineVersion,
                false, original.maxTokensPerStep, null);
    }

    public Run withStatus(RunStatus newStatus) {
        return new Run(runId, templateName, seed, params, newStatus, createdAt, completedAt,
                degraded, replayOf, engineVersion, dryRun, maxTokensPerStep, error);
    }

    /**
     * Mark as running. Replay sandboxes keep their REPLAYING status until they finish.
     */
    public Run start() {
        if (status == RunStatus.REPLAYING) {
            return this;
        }
        return new Run(runId, templateName, seed, params, RunStatus.RUNNING, createdAt, null,
                false, replayOf, engineVersion, dryRun, maxTokensPerStep, null);
    }

    public Run complete(boolean degradedResult) {
        return new Run(runId, templateName, seed, params, RunStatus.COMPLETED, createdAt, Instant.now(),
                degradedResult, replayOf, engineVersion, dryRun, maxTokensPerStep, null);
    }

    public Run fail(String errorMessage) {
        return new Run(runId, templateName, seed, params, RunStatus.FAILED, createdAt, Instant.now(),
                degraded, replayOf, engineVersion, dryRun, maxTokensPerStep, errorMessage);
    }

    public Run cancel() {
        return new Run(runId, templateName, seed, params, RunStatus.CANCELLED, createdAt, Instant.now(),
                degraded, replayOf, engineVersion, dryRun, maxTokensPerStep, "Cancelled");
    }

    public boolean isReplay() {
        return replayOf != null;
    }

    public boolean isFinished() {
        return status.isTerminal();
    }

    /**
     * Run id that step identities (idempotency keys, handler context) are derived from.
     * A replay sandbox reuses the identity of the run it replays.
     */
    public String lineageRunId() {
        return replayOf != null ? replayOf : runId;
    }
}
