package org.neuralchilli.marshal.worker;

import org.neuralchilli.marshal.core.RunSession;
import org.neuralchilli.marshal.domain.ErrorCategory;
import org.neuralchilli.marshal.domain.EventType;
import org.neuralchilli.marshal.domain.RetryPolicy;
import org.neuralchilli.marshal.domain.StepDefinition;
import org.neuralchilli.marshal.domain.StepState;
import org.neuralchilli.marshal.ledger.EventLedger;
import org.neuralchilli.marshal.resilience.CircuitBreaker;
import org.neuralchilli.marshal.resilience.CircuitBreakerRegistry;
import org.neuralchilli.marshal.resilience.CircuitOpenException;
import org.neuralchilli.marshal.resource.ConsumptionVerdict;
import org.neuralchilli.marshal.resource.ResourceMonitor;
import org.neuralchilli.marshal.service.OrchestrationException;
import org.neuralchilli.marshal.step.FatalStepException;
import org.neuralchilli.marshal.step.RunContext;
import org.neuralchilli.marshal.step.StepHandler;
import org.neuralchilli.marshal.step.StepHandlerRegistry;
import org.neuralchilli.marshal.step.StepOutput;
import org.neuralchilli.marshal.util.Hashing;
import org.neuralchilli.marshal.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.random.RandomGenerator;

/**
 * Runs one step to a terminal state: idempotency check, circuit breaker,
 * handler invocation under a timeout, retry with jittered exponential backoff.
 *
 * <p>Ledger sequence per step state: STEP_START, then zero or more STEP_RETRY,
 * then exactly one of STEP_SUCCESS, STEP_FAILURE or STEP_CANCELLED. A step whose
 * idempotency key already has a COMPLETED state returns that state without any
 * event or invocation.
 *
 * <p>Supports dry runs: the handler is not invoked, the executor logs what would
 * run and records a synthetic output.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final StepHandlerRegistry handlers;
    private final CircuitBreakerRegistry breakers;
    private final ResourceMonitor resources;
    private final EventLedger ledger;
    private final WorkerPool pool;
    private final Clock clock;

    public StepExecutor(
            StepHandlerRegistry handlers,
            CircuitBreakerRegistry breakers,
            ResourceMonitor resources,
            EventLedger ledger,
            WorkerPool pool,
            Clock clock
    ) {
        this.handlers = handlers;
        this.breakers = breakers;
        this.resources = resources;
        this.ledger = ledger;
        this.pool = pool;
        this.clock = clock;
    }

    /**
     * Execute and wait for the terminal result.
     */
    public StepResult execute(StepDefinition step, RunSession session, StepState state) {
        try {
            return executeAsync(step, session, state).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException(ErrorCategory.CANCELLED,
                    "Interrupted while executing step " + step.name(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OrchestrationException(ErrorCategory.FATAL,
                    "Step " + step.name() + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Execute without blocking. The future completes with the terminal result,
     * or exceptionally only when state or ledger persistence fails.
     */
    public CompletableFuture<StepResult> executeAsync(StepDefinition step, RunSession session, StepState state) {
        if (state.isCompleted()) {
            return CompletableFuture.completedFuture(StepResult.fromCache(state));
        }

        Optional<StepState> cached = session.states().findByIdempotencyKey(state.idempotencyKey())
                .filter(StepState::isCompleted);
        if (cached.isPresent()) {
            log.debug("Step {} of run {} already completed under key {}, reusing outputs",
                    step.name(), session.runId(), state.idempotencyKey());
            return CompletableFuture.completedFuture(StepResult.fromCache(cached.get()));
        }

        Invocation invocation = new Invocation(step, session, state);
        try {
            invocation.begin();
        } catch (RuntimeException e) {
            invocation.promise.completeExceptionally(e);
        }
        return invocation.promise;
    }

    /**
     * Failure category of an attempt error
     */
    static ErrorCategory classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return ErrorCategory.TIMEOUT;
        }
        if (error instanceof OrchestrationException orchestration) {
            return orchestration.category();
        }
        if (error instanceof InterruptedException) {
            return ErrorCategory.CANCELLED;
        }
        return ErrorCategory.TRANSIENT;
    }

    static boolean isRetryable(ErrorCategory category, RetryPolicy policy) {
        if (category == ErrorCategory.TIMEOUT) {
            return policy.retryOnTimeout();
        }
        return category.isRetryable();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error, StepDefinition step) {
        if (error instanceof TimeoutException) {
            return "Step timed out after " + step.timeout().toMillis() + "ms";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    /**
     * One step state's way through its attempts.
     */
    private final class Invocation {

        private final StepDefinition step;
        private final RunSession session;
        private final RandomGenerator jitter;
        private final CompletableFuture<StepResult> promise = new CompletableFuture<>();
        private StepState current;
        private int cycleAttempts;

        Invocation(StepDefinition step, RunSession session, StepState state) {
            this.step = step;
            this.session = session;
            this.current = state;
            Long seed = session.run().seed();
            this.jitter = seed != null
                    ? new SplittableRandom(seed ^ state.idempotencyKey().hashCode())
                    : new SplittableRandom();
        }

        void begin() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("idempotency_key", current.idempotencyKey());
            payload.put("handler", step.handler());
            payload.put("max_attempts", step.retryPolicy().maxAttempts());
            payload.put("granted_tokens", current.grantedTokens());
            payload.put("dry_run", session.run().dryRun());
            ledger.append(session.runId(), EventType.STEP_START, step.name(), payload);

            if (session.run().dryRun()) {
                dryRun();
            } else {
                attempt();
            }
        }

        void attempt() {
            CircuitBreaker acquired = null;
            try {
                if (session.isCancelled()) {
                    finishCancelled();
                    return;
                }

                Optional<StepHandler> handler = handlers.find(step.handler());
                if (handler.isEmpty()) {
                    finishFailed("No step handler registered under '" + step.handler() + "'", ErrorCategory.FATAL);
                    return;
                }

                CircuitBreaker breaker = breakers.breakerFor(session.run(), step);
                if (!breaker.tryAcquire()) {
                    rejectOpenCircuit(breaker);
                    return;
                }
                acquired = breaker;

                current = current.startAttempt();
                session.states().put(current);
                // attempts of this cycle; a resumed step keeps its earlier count in the state
                int attempt = ++cycleAttempts;
                log.debug("Step {} of run {}: attempt {}/{}", step.name(), session.runId(),
                        attempt, step.retryPolicy().maxAttempts());

                RunContext context = context();
                Map<String, Object> params = session.effectiveParams(step.name());
                Instant started = clock.instant();

                pool.submit(() -> handler.get().execute(context, params), step.timeout())
                        .whenCompleteAsync((output, error) -> {
                            Duration latency = Duration.between(started, clock.instant());
                            try {
                                if (error == null) {
                                    onSuccess(breaker, output, latency);
                                } else {
                                    onFailure(breaker, attempt, unwrap(error), latency);
                                }
                            } catch (RuntimeException e) {
                                promise.completeExceptionally(e);
                            }
                        }, pool.executor());
            } catch (RuntimeException e) {
                // the call never reached the handler: give a half-open trial back
                if (acquired != null && acquired.releaseTrial()) {
                    log.warn("Step {} of run {} could not be dispatched, circuit '{}' trial released",
                            step.name(), session.runId(), acquired.name());
                }
                promise.completeExceptionally(e);
            }
        }

        private void onSuccess(CircuitBreaker breaker, StepOutput output, Duration latency) {
            resources.recordAttempt(true, latency);
            if (breaker.recordSuccess()) {
                ledger.append(session.runId(), EventType.CIRCUIT_CLOSE, step.name(),
                        Map.of("circuit", breaker.name()));
            }

            if (output == null) {
                output = StepOutput.of(Map.of(), 0);
            }
            String hash;
            try {
                hash = Hashing.outputHash(output.outputRefs());
            } catch (IllegalArgumentException e) {
                finishFailed("Step output is not serializable: " + e.getMessage(), ErrorCategory.FATAL);
                return;
            }

            ConsumptionVerdict verdict = resources.recordConsumption(
                    step.name(), current.grantedTokens(), output.consumedTokens());
            if (verdict.throttled()) {
                current = current.throttle();
                ledger.append(session.runId(), EventType.BUDGET_THROTTLED, step.name(), verdict.toPayload());
            }

            current = current.complete(output.outputRefs(), hash, output.consumedTokens());
            session.states().put(current);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("attempts", current.attemptCount());
            payload.put("output_hash", hash);
            payload.put("consumed_tokens", output.consumedTokens());
            payload.put("granted_tokens", current.grantedTokens());
            ledger.append(session.runId(), EventType.STEP_SUCCESS, step.name(), payload);

            log.info("Step {} of run {} completed after {} attempt(s) in {}ms",
                    step.name(), session.runId(), current.attemptCount(), latency.toMillis());
            promise.complete(StepResult.executed(current));
        }

        private void onFailure(CircuitBreaker breaker, int attempt, Throwable error, Duration latency) {
            ErrorCategory category = classify(error);
            String message = describe(error, step);
            resources.recordAttempt(false, latency);

            if (breaker.recordFailure()) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("circuit", breaker.name());
                payload.put("consecutive_failures", breaker.snapshot().consecutiveFailures());
                payload.put("recovery_timeout_ms", breaker.config().recoveryTimeout().toMillis());
                ledger.append(session.runId(), EventType.CIRCUIT_OPEN, step.name(), payload);
            }

            RetryPolicy policy = step.retryPolicy();
            boolean retry = isRetryable(category, policy) && attempt < policy.maxAttempts();

            if (session.isCancelled()) {
                finishCancelled();
            } else if (retry) {
                Duration delay = policy.delayFor(attempt, jitter);
                current = current.attemptFailed(message, category);
                session.states().put(current);

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("attempt", attempt + 1);
                payload.put("error", message);
                payload.put("error_category", category.name());
                payload.put("delay_ms", delay.toMillis());
                ledger.append(session.runId(), EventType.STEP_RETRY, step.name(), payload);

                log.info("Step {} of run {} failed attempt {} ({}: {}), retrying in {}ms",
                        step.name(), session.runId(), attempt, category, message, delay.toMillis());
                CompletableFuture.runAsync(this::attempt, pool.delayed(delay));
            } else {
                finishFailed(message, category);
            }
        }

        private void rejectOpenCircuit(CircuitBreaker breaker) {
            resources.recordRejection();
            CircuitOpenException rejection = new CircuitOpenException(breaker.name(), breaker.retryAfter());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("circuit", breaker.name());
            payload.put("rejected", true);
            payload.put("retry_after_ms", rejection.retryAfter().toMillis());
            ledger.append(session.runId(), EventType.CIRCUIT_OPEN, step.name(), payload);

            finishFailed(rejection.getMessage(), rejection.category());
        }

        private void dryRun() {
            Map<String, Object> params = session.effectiveParams(step.name());

            log.info("DRY RUN - would execute step {} of run {}", step.name(), session.runId());
            log.info("  Handler: {}", step.handler());
            log.info("  Timeout: {}ms", step.timeout().toMillis());
            log.info("  Max attempts: {}", step.retryPolicy().maxAttempts());
            log.info("  Granted tokens: {}", current.grantedTokens());
            params.forEach((k, v) -> log.info("    {}={}", k, v));

            Map<String, Object> outputs = new LinkedHashMap<>();
            outputs.put("dry_run", true);
            outputs.put("handler", step.handler());
            String hash = Hashing.outputHash(outputs);

            current = current.startAttempt().complete(outputs, hash, 0);
            session.states().put(current);
            ledger.append(session.runId(), EventType.STEP_SUCCESS, step.name(),
                    Map.of("attempts", 1, "output_hash", hash, "dry_run", true));
            promise.complete(StepResult.executed(current));
        }

        private void finishFailed(String message, ErrorCategory category) {
            resources.recordFailure(step.name());
            current = current.fail(message, category);
            session.states().put(current);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("error", message);
            payload.put("error_category", category.name());
            payload.put("idempotency_key", current.idempotencyKey());
            payload.put("attempts", current.attemptCount());
            ledger.append(session.runId(), EventType.STEP_FAILURE, step.name(), payload);

            log.warn("Step {} of run {} failed after {} attempt(s): {} ({})",
                    step.name(), session.runId(), current.attemptCount(), message, category);
            promise.complete(StepResult.executed(current));
        }

        private void finishCancelled() {
            current = current.cancel();
            session.states().put(current);
            ledger.append(session.runId(), EventType.STEP_CANCELLED, step.name(),
                    Map.of("attempts", current.attemptCount()));
            log.info("Step {} of run {} cancelled", step.name(), session.runId());
            promise.complete(StepResult.executed(current));
        }

        private RunContext context() {
            int sequence = (session.nextSpanSequence() - 1) % 9999 + 1;
            return new RunContext(
                    session.run().lineageRunId(),
                    session.runId(),
                    step.name(),
                    Identifiers.spanId(session.runId(), sequence, step.handler()),
                    session.run().seed(),
                    session.upstreamOutputs(step.name()),
                    current.grantedTokens(),
                    session::isCancelled
            );
        }
    }
}
