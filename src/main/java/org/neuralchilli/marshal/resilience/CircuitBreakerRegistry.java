package org.neuralchilli.marshal.resilience;

import org.neuralchilli.marshal.domain.Run;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the circuit breakers of all steps. Breakers are created on first use from
 * the step's configuration and keyed according to the registry's {@link BreakerScope}.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final BreakerScope scope;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(BreakerScope scope, Clock clock) {
        this.scope = scope;
        this.clock = clock;
        log.info("Circuit breaker registry initialized with scope {}", scope);
    }

    public BreakerScope scope() {
        return scope;
    }

    public CircuitBreaker breakerFor(Run run, StepDefinition step) {
        String key = keyFor(run, step.name());
        return breakers.computeIfAbsent(key, k -> new CircuitBreaker(k, step.circuitBreaker(), clock));
    }

    public String keyFor(Run run, String stepName) {
        return switch (scope) {
            case TEMPLATE -> run.templateName() + "/" + stepName;
            case RUN -> run.runId() + "/" + stepName;
        };
    }

    public Optional<CircuitBreaker> find(String key) {
        return Optional.ofNullable(breakers.get(key));
    }

    /**
     * Current state of every breaker, ordered by key
     */
    public Map<String, CircuitBreaker.Snapshot> snapshot() {
        Map<String, CircuitBreaker.Snapshot> result = new TreeMap<>();
        breakers.forEach((key, breaker) -> result.put(key, breaker.snapshot()));
        return result;
    }

    /**
     * Force one breaker closed.
     *
     * @return false if no breaker exists under {@code key}
     */
    public boolean reset(String key) {
        CircuitBreaker breaker = breakers.get(key);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    /**
     * Forget RUN-scoped breakers of a finished run
     */
    public void release(Run run) {
        if (scope == BreakerScope.RUN) {
            breakers.keySet().removeIf(key -> key.startsWith(run.runId() + "/"));
        }
    }
}
