package org.neuralchilli.marshal.service;

import java.util.Map;

/**
 * Request to start a run of a pipeline template.
 *
 * @param params           overrides for the template's default parameters
 * @param seed             seed for handler randomness and retry jitter, optional
 * @param maxTokensPerStep cap on any single step's token grant, optional
 * @param dryRun           walk and admit steps without invoking handlers
 */
public record RunRequest(
        String template,
        Map<String, Object> params,
        Long seed,
        Long maxTokensPerStep,
        boolean dryRun
) {

    public RunRequest {
        if (template == null || template.isBlank()) {
            throw new ConfigurationException("Run request must name a pipeline template");
        }
        if (maxTokensPerStep != null && maxTokensPerStep <= 0) {
            throw new ConfigurationException("max_tokens_per_step must be positive, got: " + maxTokensPerStep);
        }
        if (params == null) {
            params = Map.of();
        }
    }

    public static RunRequest of(String template) {
        return new RunRequest(template, Map.of(), null, null, false);
    }

    public RunRequest withParams(Map<String, Object> newParams) {
        return new RunRequest(template, newParams, seed, maxTokensPerStep, dryRun);
    }

    public RunRequest withSeed(long newSeed) {
        return new RunRequest(template, params, newSeed, maxTokensPerStep, dryRun);
    }

    public RunRequest withMaxTokensPerStep(long maxTokens) {
        return new RunRequest(template, params, seed, maxTokens, dryRun);
    }

    public RunRequest asDryRun() {
        return new RunRequest(template, params, seed, maxTokensPerStep, true);
    }
}
