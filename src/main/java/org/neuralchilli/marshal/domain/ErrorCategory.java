package org.neuralchilli.marshal.domain;

/**
 * Failure taxonomy shared by exceptions, step states and ledger payloads.
 * Each category maps to the process exit code reported to callers.
 */
public enum ErrorCategory {
    CONFIGURATION(2, false),
    VALIDATION(3, false),
    RESOURCE_DENIED(4, false),
    TRANSIENT(5, true),
    TIMEOUT(5, true),
    CIRCUIT_OPEN(5, false),
    FATAL(5, false),
    CANCELLED(6, false);

    private final int exitCode;
    private final boolean retryable;

    ErrorCategory(int exitCode, boolean retryable) {
        this.exitCode = exitCode;
        this.retryable = retryable;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Whether the executor may retry an attempt that failed with this category.
     * Timeouts can still be made fatal per step through its retry policy.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
