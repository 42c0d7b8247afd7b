package org.neuralchilli.marshal.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A node of a pipeline template. Defined once per template and instantiated per run.
 */
public record StepDefinition(
        String name,
        String handler,
        Map<String, Object> params,  // values may contain ${...} expressions
        List<String> dependsOn,
        Duration timeout,
        long tokenBudgetBase,
        long requestedTokens,
        Priority priority,
        boolean optional,
        RetryPolicy retryPolicy,
        CircuitBreakerConfig circuitBreaker
) implements Serializable {

    public StepDefinition {
        // Validation
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be null or empty");
        }

        if (!name.matches("^[a-z0-9-]+$")) {
            throw new IllegalArgumentException(
                    "Step name must match pattern ^[a-z0-9-]+$, got: " + name
            );
        }

        if (handler == null || handler.isBlank()) {
            throw new IllegalArgumentException("Step '" + name + "' must name a handler");
        }

        if (tokenBudgetBase <= 0) {
            throw new IllegalArgumentException(
                    "Step '" + name + "' token budget must be positive, got: " + tokenBudgetBase
            );
        }

        // Defaults
        if (params == null) {
            params = Map.of();
        }
        if (dependsOn == null) {
            dependsOn = List.of();
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = Duration.ofMinutes(10);
        }
        if (requestedTokens <= 0) {
            requestedTokens = tokenBudgetBase;
        }
        if (priority == null) {
            priority = Priority.NORMAL;
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaults();
        }
        if (circuitBreaker == null) {
            circuitBreaker = CircuitBreakerConfig.defaults();
        }

        params = Map.copyOf(params);
        dependsOn = List.copyOf(dependsOn);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String handler;
        private Map<String, Object> params = Map.of();
        private List<String> dependsOn = List.of();
        private Duration timeout = Duration.ofMinutes(10);
        private long tokenBudgetBase = 1000;
        private long requestedTokens;
        private Priority priority = Priority.NORMAL;
        private boolean optional;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();

        public Builder(String name) {
            this.name = name;
        }

        public Builder handler(String handler) {
            this.handler = handler;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder dependsOn(String... dependsOn) {
            this.dependsOn = List.of(dependsOn);
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder tokenBudgetBase(long tokenBudgetBase) {
            this.tokenBudgetBase = tokenBudgetBase;
            return this;
        }

        public Builder requestedTokens(long requestedTokens) {
            this.requestedTokens = requestedTokens;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(name, handler, params, dependsOn, timeout,
                    tokenBudgetBase, requestedTokens, priority, optional, retryPolicy, circuitBreaker);
        }
    }
}
