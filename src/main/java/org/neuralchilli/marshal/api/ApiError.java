package org.neuralchilli.marshal.api;

/**
 * Error body returned by the REST API.
 *
 * @param category  orchestration error category, null for non-orchestration errors
 * @param exitCode  exit code a CLI would report for the same error
 */
public record ApiError(int status, String category, int exitCode, String message) {
}
