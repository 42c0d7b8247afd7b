package org.neuralchilli.marshal.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.marshal.domain.CircuitBreakerConfig;
import org.neuralchilli.marshal.domain.PipelineTemplate;
import org.neuralchilli.marshal.domain.Priority;
import org.neuralchilli.marshal.domain.RetryPolicy;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.service.ConfigurationException;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses pipeline template YAML into {@link PipelineTemplate}.
 *
 * <pre>
 * name: research
 * params:
 *   topic: llm-evals
 * steps:
 *   - name: ingest
 *     handler: http-fetch
 *     timeout: 30s
 *     token_budget: 2000
 *     retry:
 *       max_attempts: 4
 *       base_delay: 500ms
 *   - name: analyze
 *     handler: llm
 *     depends_on: [ingest]
 *     params:
 *       prompt: "Summarise ${params.topic}"
 * </pre>
 */
@ApplicationScoped
public class YamlParser {

    private static final Pattern SHORT_DURATION = Pattern.compile("^(\\d+)(ms|s|m|h)$");

    /**
     * Parse a pipeline template from a YAML string
     */
    public PipelineTemplate parsePipeline(String yamlContent) {
        return parsePipelineFromMap(load(yamlContent));
    }

    /**
     * Parse a pipeline template from an InputStream
     */
    public PipelineTemplate parsePipeline(InputStream inputStream) {
        try {
            Object data = new Yaml().load(inputStream);
            return parsePipelineFromMap(asMap(data, "document"));
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> load(String yamlContent) {
        try {
            // Yaml instances are not thread-safe
            Object data = new Yaml().load(yamlContent);
            return asMap(data, "document");
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage(), e);
        }
    }

    private PipelineTemplate parsePipelineFromMap(Map<String, Object> data) {
        String name = getString(data, "name", true);
        String description = getString(data, "description", false);
        Map<String, Object> params = getMap(data, "params");

        Object stepsValue = data.get("steps");
        if (!(stepsValue instanceof List<?> stepsList) || stepsList.isEmpty()) {
            throw new ConfigurationException("Pipeline '" + name + "' must have at least one step");
        }

        List<StepDefinition> steps = new ArrayList<>();
        for (Object stepData : stepsList) {
            steps.add(parseStep(asMap(stepData, "step")));
        }

        try {
            return new PipelineTemplate(name, description, params, steps);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private StepDefinition parseStep(Map<String, Object> data) {
        String name = getString(data, "name", true);
        try {
            long tokenBudget = getLong(data, "token_budget", 1000);
            return StepDefinition.builder(name)
                    .handler(getString(data, "handler", true))
                    .params(getMap(data, "params"))
                    .dependsOn(getStringList(data, "depends_on"))
                    .timeout(getDuration(data, "timeout", Duration.ofMinutes(10)))
                    .tokenBudgetBase(tokenBudget)
                    .requestedTokens(getLong(data, "requested_tokens", tokenBudget))
                    .priority(Priority.fromString(getString(data, "priority", false)))
                    .optional(getBoolean(data, "optional", false))
                    .retryPolicy(parseRetry(data.get("retry")))
                    .circuitBreaker(parseCircuitBreaker(data.get("circuit_breaker")))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid step '" + name + "': " + e.getMessage(), e);
        }
    }

    private RetryPolicy parseRetry(Object value) {
        if (value == null) {
            return RetryPolicy.defaults();
        }
        Map<String, Object> data = asMap(value, "retry");
        RetryPolicy defaults = RetryPolicy.defaults();
        return new RetryPolicy(
                (int) getLong(data, "max_attempts", defaults.maxAttempts()),
                getDuration(data, "base_delay", defaults.baseDelay()),
                getDuration(data, "max_delay", defaults.maxDelay()),
                getDouble(data, "jitter", defaults.jitterFactor()),
                getBoolean(data, "retry_on_timeout", defaults.retryOnTimeout())
        );
    }

    private CircuitBreakerConfig parseCircuitBreaker(Object value) {
        if (value == null) {
            return CircuitBreakerConfig.defaults();
        }
        Map<String, Object> data = asMap(value, "circuit_breaker");
        CircuitBreakerConfig defaults = CircuitBreakerConfig.defaults();
        return new CircuitBreakerConfig(
                (int) getLong(data, "failure_threshold", defaults.failureThreshold()),
                getDuration(data, "recovery_timeout", defaults.recoveryTimeout())
        );
    }

    /**
     * Durations: a number of seconds, a short form such as {@code 500ms}, {@code 30s},
     * {@code 5m}, {@code 1h}, or ISO-8601 ({@code PT30S}).
     */
    static Duration parseDuration(Object value) {
        if (value instanceof Number number) {
            return Duration.ofMillis(Math.round(number.doubleValue() * 1000));
        }
        String text = value.toString().trim();
        Matcher matcher = SHORT_DURATION.matcher(text);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(amount);
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                default -> Duration.ofHours(amount);
            };
        }
        try {
            return Duration.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: " + text, e);
        }
    }

    // Type-safe extraction

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String what) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ConfigurationException("Expected a mapping for " + what + ", got: " + value);
    }

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new ConfigurationException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    private Duration getDuration(Map<String, Object> map, String key, Duration defaultValue) {
        Object value = map.get(key);
        return value == null ? defaultValue : parseDuration(value);
    }

    private List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(Object::toString)
                    .toList();
        }
        return List.of(value.toString());
    }

    private Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        return new LinkedHashMap<>(asMap(value, key));
    }
}
